package com.example.logpipeline.postgres;

import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendContract;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class PostgresStorageBackendContractTest extends StorageBackendContract {

    @Container
    @ServiceConnection
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:15-alpine"))
            .withDatabaseName("logpipeline_test")
            .withUsername("test")
            .withPassword("test");

    @Autowired
    private LogEntryRepository logEntryRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private PostgresStorageBackend backend;

    @BeforeEach
    void setUp() {
        backend = new PostgresStorageBackend(logEntryRepository, new LogEntrySpecification(), jdbcTemplate);
        backend.ensureSchema();
    }

    @Override
    protected LogStorageBackend backend() {
        return backend;
    }
}
