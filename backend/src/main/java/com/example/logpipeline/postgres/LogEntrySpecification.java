package com.example.logpipeline.postgres;

import com.example.logpipeline.logs.models.QueryFilter;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class LogEntrySpecification {

    private static final char ESCAPE = '\\';

    public Specification<LogEntry> buildSpecification(QueryFilter filter) {
        return (root, criteriaQuery, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.search() != null) {
                String pattern = "%" + escapeLike(filter.search().toLowerCase(Locale.ROOT)) + "%";
                predicates.add(criteriaBuilder.or(
                        criteriaBuilder.like(criteriaBuilder.lower(root.get("message")), pattern, ESCAPE),
                        criteriaBuilder.like(criteriaBuilder.lower(root.get("service")), pattern, ESCAPE)
                ));
            }

            if (filter.level() != null) {
                predicates.add(criteriaBuilder.equal(root.get("level"), filter.level()));
            }

            if (filter.service() != null) {
                predicates.add(criteriaBuilder.equal(root.get("service"), filter.service()));
            }

            if (filter.projectId() != null) {
                predicates.add(criteriaBuilder.equal(root.get("projectId"), filter.projectId()));
            }

            if (filter.fromTs() != null) {
                predicates.add(criteriaBuilder.greaterThanOrEqualTo(root.get("timestamp"), filter.fromTs()));
            }

            if (filter.toTs() != null) {
                predicates.add(criteriaBuilder.lessThanOrEqualTo(root.get("timestamp"), filter.toTs()));
            }

            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
