package com.example.logpipeline.postgres;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LogEntryRepository extends JpaRepository<LogEntry, String>, JpaSpecificationExecutor<LogEntry> {

    @Query("select distinct e.service from LogEntry e")
    List<String> findDistinctServices();
}
