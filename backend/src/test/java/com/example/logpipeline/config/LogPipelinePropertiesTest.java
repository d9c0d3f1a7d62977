package com.example.logpipeline.config;

import com.example.logpipeline.config.LogPipelineProperties.KafkaProperties;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LogPipelinePropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    // ==================== Publish timeout ====================

    @Test
    void shouldRejectPublishTimeoutBelowMinimum() {
        KafkaProperties kafka = new KafkaProperties("logs", "logs-dlq", "log-consumer-group", Duration.ofMillis(15));

        Set<ConstraintViolation<KafkaProperties>> violations = validator.validate(kafka);

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.getMessage()).contains("publish-timeout"));
    }

    @Test
    void shouldAcceptPublishTimeoutAtMinimum() {
        KafkaProperties kafka = new KafkaProperties("logs", "logs-dlq", "log-consumer-group",
                KafkaProperties.MIN_PUBLISH_TIMEOUT);

        assertThat(validator.validate(kafka)).isEmpty();
    }

    @Test
    void shouldFailBindingWhenPublishTimeoutTooShort() {
        contextRunner
                .withPropertyValues("logpipeline.kafka.publish-timeout=15ms")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBindDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            LogPipelineProperties properties = context.getBean(LogPipelineProperties.class);
            assertThat(properties.storage().backend()).isEqualTo("elasticsearch");
            assertThat(properties.kafka().publishTimeout()).isEqualTo(Duration.ofSeconds(10));
            assertThat(properties.auth().projects()).isEmpty();
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(LogPipelineProperties.class)
    static class PropertiesConfiguration {
    }
}
