package com.example.logpipeline.postgres;

import com.example.logpipeline.logs.models.LogLevel;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "log_entries", indexes = {
        @Index(name = "idx_log_entries_timestamp", columnList = "timestamp"),
        @Index(name = "idx_log_entries_level", columnList = "level"),
        @Index(name = "idx_log_entries_service", columnList = "service"),
        @Index(name = "idx_log_entries_project_id", columnList = "project_id")
})
@Data
public class LogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private LogLevel level;

    @Column(nullable = false)
    private String service;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "JSONB")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "project_id", nullable = false)
    private String projectId;
}
