package com.example.logpipeline.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class PipelineMetrics {

    private final Counter logsPublishedCounter;
    private final Counter logsPublishFailedCounter;
    private final Counter logsConsumedCounter;
    private final Counter logsSaveFailedCounter;
    private final Counter logsDeadLetteredCounter;

    private final Timer consumerBatchProcessingTime;
    private final Timer apiResponseTime;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        //producer metrics
        this.logsPublishedCounter = Counter.builder("logs.published.total")
                .description("Total number of logs acknowledged by Kafka")
                .register(meterRegistry);

        this.logsPublishFailedCounter = Counter.builder("logs.publish.failed.total")
                .description("Total number of logs Kafka did not acknowledge in time")
                .register(meterRegistry);

        this.apiResponseTime = Timer.builder("api.logs.ingest.duration")
                .description("Time taken to accept a log via the API, including the Kafka ack")
                .register(meterRegistry);

        //consumer metrics
        this.logsConsumedCounter = Counter.builder("logs.consumed.total")
                .description("Total number of logs consumed and saved to storage")
                .register(meterRegistry);

        this.logsSaveFailedCounter = Counter.builder("logs.save.failed.total")
                .description("Total number of consumed logs the storage backend rejected")
                .register(meterRegistry);

        this.consumerBatchProcessingTime = Timer.builder("consumer.batch.processing.duration")
                .description("Time taken to process a batch of logs")
                .register(meterRegistry);

        //error metrics
        this.logsDeadLetteredCounter = Counter.builder("logs.dlq.total")
                .description("Total number of logs sent to the dead letter topic")
                .register(meterRegistry);
    }

    public void recordLogPublished() {
        logsPublishedCounter.increment();
    }

    public void recordPublishFailed() {
        logsPublishFailedCounter.increment();
    }

    public void recordBatchConsumed(int count) {
        logsConsumedCounter.increment(count);
    }

    public void recordSaveFailed(int count) {
        logsSaveFailedCounter.increment(count);
    }

    public void recordDeadLettered() {
        logsDeadLetteredCounter.increment();
    }

    public void recordApiResponse(long startTimeNanos) {
        apiResponseTime.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }

    public void recordConsumerBatchProcessingTime(long startTimeNanos) {
        consumerBatchProcessingTime.record(
                System.nanoTime() - startTimeNanos,
                TimeUnit.NANOSECONDS
        );
    }

    public double publishedCount() {
        return logsPublishedCounter.count();
    }

    public double publishFailedCount() {
        return logsPublishFailedCounter.count();
    }

    public double consumedCount() {
        return logsConsumedCounter.count();
    }

    public double saveFailedCount() {
        return logsSaveFailedCounter.count();
    }

    public double deadLetteredCount() {
        return logsDeadLetteredCounter.count();
    }
}
