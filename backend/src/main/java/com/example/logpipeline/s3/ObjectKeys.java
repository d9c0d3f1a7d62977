package com.example.logpipeline.s3;

import com.example.logpipeline.logs.models.LogRecord;
import com.example.logpipeline.logs.models.QueryFilter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Object key layout: {@code prefix/project/YYYY/MM/DD/HH/<yyyyMMddHHmmssSSS>_<service>_<level>_<digest>.json}.
 * The date path exists only to narrow listings; it is not an index.
 * The digest covers the whole record, so distinct records logged in the same
 * millisecond get distinct keys while an identical record always maps to the same key.
 */
public final class ObjectKeys {

    static final String SUFFIX = ".json";

    private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd/HH");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");
    private static final Pattern UNSAFE_SEGMENT_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final int DIGEST_HEX_CHARS = 12;

    private final String rootPrefix;

    public ObjectKeys(String prefix) {
        String trimmed = prefix == null ? "" : prefix.strip().replaceAll("^/+|/+$", "");
        this.rootPrefix = trimmed.isEmpty() ? "" : trimmed + "/";
    }

    public String rootPrefix() {
        return rootPrefix;
    }

    public String keyFor(LogRecord record) {
        ZonedDateTime time = record.timestamp().atZone(ZoneOffset.UTC);
        return rootPrefix
                + segment(record.projectId()) + "/"
                + DATE_PATH.format(time) + "/"
                + STAMP.format(time) + "_"
                + segment(record.service()) + "_"
                + record.level().name() + "_"
                + digest(record)
                + SUFFIX;
    }

    /**
     * Narrowest prefix that still contains every object the filter can match.
     * Without a project the date path cannot be used, because the project comes first.
     * With a project and both bounds, the date components the two bounds share are appended.
     */
    public String listingPrefix(QueryFilter filter) {
        if (filter.projectId() == null) {
            return rootPrefix;
        }
        String projectPrefix = rootPrefix + segment(filter.projectId()) + "/";
        if (filter.fromTs() == null || filter.toTs() == null) {
            return projectPrefix;
        }
        String[] from = DATE_PATH.format(filter.fromTs().atZone(ZoneOffset.UTC)).split("/");
        String[] to = DATE_PATH.format(filter.toTs().atZone(ZoneOffset.UTC)).split("/");
        StringBuilder prefix = new StringBuilder(projectPrefix);
        for (int i = 0; i < from.length && from[i].equals(to[i]); i++) {
            prefix.append(from[i]).append('/');
        }
        return prefix.toString();
    }

    static String segment(String value) {
        String cleaned = UNSAFE_SEGMENT_CHARS.matcher(value).replaceAll("-");
        return cleaned.isEmpty() ? "-" : cleaned;
    }

    static String digest(LogRecord record) {
        String canonical = String.join("\u0000",
                record.timestamp().toString(),
                record.level().name(),
                record.service(),
                record.projectId(),
                record.message(),
                String.valueOf(record.metadata()));
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
