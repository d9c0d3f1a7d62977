package com.example.logpipeline.s3;

import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;
import com.example.logpipeline.logs.models.QueryResult;
import com.example.logpipeline.storage.LogStorageBackend;
import com.example.logpipeline.storage.StorageBackendType;
import com.example.logpipeline.storage.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Object-store backend. One JSON object per record, with level, service and project_id
 * copied into the object's user metadata so most filters run on a HEAD request alone.
 * <p>
 * There is no server-side query: every {@link #queryLogs} and {@link #getUniqueServices}
 * call lists every object under the listing prefix and issues one HEAD per object, plus a
 * GET for each object that passes the metadata filters. Cost is O(objects under the prefix)
 * per call, which suits low-volume or cold storage, not high query rates.
 */
@Slf4j
public class S3StorageBackend implements LogStorageBackend {

    static final String META_LEVEL = "level";
    static final String META_SERVICE = "service";
    static final String META_PROJECT = "project_id";

    private static final int LIST_PAGE_SIZE = 1000;

    static final Comparator<LogRecord> NEWEST_FIRST = Comparator
            .comparing(LogRecord::timestamp)
            .thenComparing(LogRecord::id)
            .reversed();

    private final S3Client s3Client;
    private final ObjectMapper objectMapper;
    private final String bucket;
    private final ObjectKeys objectKeys;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public S3StorageBackend(S3Client s3Client, ObjectMapper objectMapper, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.objectMapper = objectMapper;
        this.bucket = bucket;
        this.objectKeys = new ObjectKeys(prefix);
    }

    /**
     * Creates the bucket if it does not exist. Losing a creation race to another process is fine.
     */
    public void ensureBucket(String region) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            log.debug("Bucket {} exists", bucket);
            return;
        } catch (NoSuchBucketException e) {
            log.info("Bucket {} not found, creating it", bucket);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw e;
            }
            log.info("Bucket {} not found (404), creating it", bucket);
        }

        CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucket);
        if (!Region.US_EAST_1.id().equals(region)) {
            request.createBucketConfiguration(CreateBucketConfiguration.builder()
                    .locationConstraint(region)
                    .build());
        }
        try {
            s3Client.createBucket(request.build());
            log.info("Created bucket {}", bucket);
        } catch (BucketAlreadyOwnedByYouException | BucketAlreadyExistsException e) {
            log.info("Bucket {} was created concurrently", bucket);
        }
    }

    @Override
    public StorageBackendType type() {
        return StorageBackendType.S3;
    }

    @Override
    public boolean save(LogRecord record) {
        String key = objectKeys.keyFor(record);
        try {
            byte[] body = objectMapper.writeValueAsBytes(record.withId(null));
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType("application/json")
                    .metadata(sidecarFor(record))
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(body));
            log.debug("Stored log object key={}", key);
            return true;
        } catch (Exception e) {
            log.error("Failed to store log in S3: key={}, service={}, projectId={}, error={}",
                    key, record.service(), record.projectId(), e.getMessage());
            return false;
        }
    }

    public String keyFor(LogRecord record) {
        return objectKeys.keyFor(record);
    }

    @Override
    public QueryResult queryLogs(QueryFilter filter) {
        String prefix = objectKeys.listingPrefix(filter);
        try {
            List<LogRecord> matched = new ArrayList<>();
            int scanned = 0;
            for (S3Object object : listObjects(prefix)) {
                scanned++;
                Map<String, String> sidecar = headSidecar(object.key());
                if (sidecar == null || !matchesSidecar(sidecar, filter)) {
                    continue;
                }
                LogRecord record = readRecord(object.key());
                if (record != null && matchesBody(record, filter)) {
                    matched.add(record.withId(object.key()));
                }
            }

            matched.sort(NEWEST_FIRST);
            log.debug("S3 query scanned {} objects under {}, {} matched", scanned, prefix, matched.size());
            if (filter.offset() >= matched.size()) {
                return QueryResult.of(List.of(), matched.size(), filter);
            }
            int from = (int) filter.offset();
            int to = Math.min(from + filter.size(), matched.size());
            return QueryResult.of(matched.subList(from, to), matched.size(), filter);
        } catch (Exception e) {
            log.error("S3 query failed: prefix={}, filter={}, error={}", prefix, filter, e.getMessage());
            throw new StorageException(type(), "Failed to query logs from S3", e);
        }
    }

    @Override
    public List<String> getUniqueServices() {
        try {
            TreeSet<String> services = new TreeSet<>();
            for (S3Object object : listObjects(objectKeys.rootPrefix())) {
                Map<String, String> sidecar = headSidecar(object.key());
                if (sidecar != null && sidecar.get(META_SERVICE) != null) {
                    services.add(sidecar.get(META_SERVICE));
                }
            }
            return List.copyOf(services);
        } catch (Exception e) {
            log.error("S3 service listing failed: {}", e.getMessage());
            throw new StorageException(type(), "Failed to list services from S3", e);
        }
    }

    @Override
    public boolean healthCheck() {
        try {
            s3Client.listObjectsV2(ListObjectsV2Request.builder().bucket(bucket).maxKeys(1).build());
            return true;
        } catch (Exception e) {
            log.warn("S3 health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            s3Client.close();
            log.info("S3 storage backend closed");
        }
    }

    // ==================== Listing and reads ====================

    private List<S3Object> listObjects(String prefix) {
        List<S3Object> objects = new ArrayList<>();
        String continuationToken = null;
        do {
            ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .maxKeys(LIST_PAGE_SIZE);
            if (continuationToken != null) {
                request.continuationToken(continuationToken);
            }
            ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
            for (S3Object object : response.contents()) {
                if (object.key().endsWith(ObjectKeys.SUFFIX)) {
                    objects.add(object);
                }
            }
            continuationToken = Boolean.TRUE.equals(response.isTruncated())
                    ? response.nextContinuationToken()
                    : null;
        } while (continuationToken != null);
        return objects;
    }

    /**
     * @return decoded sidecar, or null when the object disappeared between listing and HEAD
     */
    private Map<String, String> headSidecar(String key) {
        try {
            HeadObjectResponse head = s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            Map<String, String> decoded = new HashMap<>();
            head.metadata().forEach((name, value) ->
                    decoded.put(name.toLowerCase(Locale.ROOT), URLDecoder.decode(value, StandardCharsets.UTF_8)));
            return decoded;
        } catch (NoSuchKeyException e) {
            log.warn("Object {} vanished before its metadata was read", key);
            return null;
        }
    }

    /**
     * @return the parsed record, or null when the object is gone or not a log record
     */
    private LogRecord readRecord(String key) {
        try {
            ResponseBytes<GetObjectResponse> bytes = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return objectMapper.readValue(bytes.asByteArray(), LogRecord.class);
        } catch (NoSuchKeyException e) {
            log.warn("Object {} vanished before it was read", key);
            return null;
        } catch (IOException e) {
            log.warn("Skipping unreadable log object {}: {}", key, e.getMessage());
            return null;
        }
    }

    // ==================== Filtering ====================

    static Map<String, String> sidecarFor(LogRecord record) {
        Map<String, String> sidecar = new HashMap<>();
        sidecar.put(META_LEVEL, encode(record.level().name()));
        sidecar.put(META_SERVICE, encode(record.service()));
        sidecar.put(META_PROJECT, encode(record.projectId()));
        return sidecar;
    }

    static boolean matchesSidecar(Map<String, String> sidecar, QueryFilter filter) {
        if (filter.level() != null && !filter.level().name().equals(sidecar.get(META_LEVEL))) {
            return false;
        }
        if (filter.service() != null && !filter.service().equals(sidecar.get(META_SERVICE))) {
            return false;
        }
        return filter.projectId() == null || filter.projectId().equals(sidecar.get(META_PROJECT));
    }

    static boolean matchesBody(LogRecord record, QueryFilter filter) {
        if (filter.search() != null) {
            String needle = filter.search().toLowerCase(Locale.ROOT);
            if (!containsIgnoreCase(record.message(), needle) && !containsIgnoreCase(record.service(), needle)) {
                return false;
            }
        }
        return filter.matchesTime(record.timestamp());
    }

    private static boolean containsIgnoreCase(String field, String lowerCaseNeedle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(lowerCaseNeedle);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
