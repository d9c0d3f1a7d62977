package com.example.logpipeline;

import com.example.logpipeline.storage.StorageBackendSelector;
import com.example.logpipeline.storage.StorageBackendType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class LogPipelineApplicationTests {

    @Container
    @ServiceConnection
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:15-alpine"))
            .withDatabaseName("logpipeline_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static final KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    // KafkaConfig builds its own factories from this property
    @DynamicPropertySource
    static void kafkaProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StorageBackendSelector storageBackendSelector;

    @Test
    void contextLoads() {
        assertThat(storageBackendSelector.defaultType()).isEqualTo(StorageBackendType.POSTGRES);
    }

    @Test
    void shouldMakeIngestedLogQueryableThroughTheQueue() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .header("X-API-Key", "secret:p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "service" : "checkout",
                                    "level" : "ERROR",
                                    "message" : "payment gateway unreachable",
                                    "metadata" : {"order_id": "o-42"}
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.project_id").value("p1"));

        await().atMost(Duration.ofSeconds(30)).pollInterval(Duration.ofMillis(500)).untilAsserted(() ->
                mockMvc.perform(get("/api/v1/logs")
                                .param("service", "checkout")
                                .param("project_id", "p1"))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.total").value(1))
                        .andExpect(jsonPath("$.logs[0].message").value("payment gateway unreachable"))
                        .andExpect(jsonPath("$.logs[0].metadata.order_id").value("o-42")));

        mockMvc.perform(get("/api/v1/logs/services"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.services[0]").value("checkout"));
    }

    @Test
    void shouldRejectIngestWithoutValidKey() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .header("X-API-Key", "wrong:p1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message" : "x"}
                                """))
                .andExpect(status().isUnauthorized());
    }
}
