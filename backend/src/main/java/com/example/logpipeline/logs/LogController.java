package com.example.logpipeline.logs;

import com.example.logpipeline.auth.ApiKeyProjectResolver;
import com.example.logpipeline.kafka.LogProducer;
import com.example.logpipeline.kafka.QueuePublishException;
import com.example.logpipeline.logs.DTOs.LogIngestRequest;
import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.LogTimestamps;
import com.example.logpipeline.logs.models.QueryFilter;
import com.example.logpipeline.logs.models.QueryResult;
import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendSelector;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/v1/logs")
public class LogController {

    static final String API_KEY_HEADER = "X-API-Key";

    private final LogProducer logProducer;
    private final StorageBackendSelector storageBackendSelector;
    private final ApiKeyProjectResolver apiKeyProjectResolver;
    private final Validator validator;
    private final Clock clock;

    public LogController(LogProducer logProducer,
                         StorageBackendSelector storageBackendSelector,
                         ApiKeyProjectResolver apiKeyProjectResolver,
                         Validator validator) {
        this.logProducer = logProducer;
        this.storageBackendSelector = storageBackendSelector;
        this.apiKeyProjectResolver = apiKeyProjectResolver;
        this.validator = validator;
        this.clock = Clock.systemUTC();
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> ingestLog(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody LogIngestRequest request) {
        String projectId = apiKeyProjectResolver.resolveProjectFromCredential(apiKey);
        LogRecord record = request.toRecord(projectId, clock.instant());

        if (!logProducer.publish(record)) {
            throw new QueuePublishException("Failed to send log to Kafka");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("message", "Log queued for processing");
        body.put("timestamp", record.timestamp().toString());
        body.put("project_id", projectId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> ingestBatch(
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
            @RequestBody List<LogIngestRequest> requests) {
        String projectId = apiKeyProjectResolver.resolveProjectFromCredential(apiKey);
        validateAll(requests);

        List<LogRecord> records = requests.stream()
                .map(request -> request.toRecord(projectId, clock.instant()))
                .toList();

        LogProducer.BatchPublishResult result = logProducer.publishAll(records);
        if (result.allFailed()) {
            throw new QueuePublishException("Failed to send any logs to Kafka");
        }
        if (result.failed() > 0) {
            log.warn("Partial batch publish for project {}: {} queued, {} failed",
                    projectId, result.queued(), result.failed());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("message", "Batch of " + result.queued() + "/" + records.size() + " logs queued for processing");
        body.put("queued", result.queued());
        body.put("failed", result.failed());
        body.put("project_id", projectId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping
    public ResponseEntity<QueryResult> queryLogs(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String service,
            @RequestParam(name = "project_id", required = false) String projectId,
            @RequestParam(required = false) String backend,
            @RequestParam(name = "from_ts", required = false) String fromTs,
            @RequestParam(name = "to_ts", required = false) String toTs,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int size) {

        QueryFilter filter = QueryFilter.builder()
                .search(search)
                .level(level)
                .service(service)
                .projectId(projectId)
                .fromTs(LogTimestamps.parseOrNull(fromTs))
                .toTs(LogTimestamps.parseOrNull(toTs))
                .page(page)
                .size(size)
                .build();

        LogStorageBackend storage = storageBackendSelector.resolve(backend);
        log.debug("Query on {}: {}", storage.type().backendName(), filter);
        return ResponseEntity.ok(storage.queryLogs(filter));
    }

    @GetMapping("/services")
    public ResponseEntity<Map<String, List<String>>> getServices(
            @RequestParam(required = false) String backend) {
        LogStorageBackend storage = storageBackendSelector.resolve(backend);
        return ResponseEntity.ok(Map.of("services", storage.getUniqueServices()));
    }

    private void validateAll(List<LogIngestRequest> requests) {
        Set<ConstraintViolation<LogIngestRequest>> violations = new HashSet<>();
        for (LogIngestRequest request : requests) {
            violations.addAll(validator.validate(request));
        }
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }
}
