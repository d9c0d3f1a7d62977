package com.example.logpipeline.auth;

import com.example.logpipeline.config.LogPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Credentials look like {@code <apiKey>:<projectId>}. The key's SHA-256 must equal the hash
 * configured for that project under {@code logpipeline.auth.projects}.
 */
@Slf4j
@Component
public class ConfiguredApiKeyProjectResolver implements ApiKeyProjectResolver {

    private final Map<String, String> projectKeyHashes;

    public ConfiguredApiKeyProjectResolver(LogPipelineProperties properties) {
        this.projectKeyHashes = properties.auth().projects();
        if (projectKeyHashes.isEmpty()) {
            log.warn("No projects configured under logpipeline.auth.projects; every ingest request will be rejected");
        }
    }

    @Override
    public String resolveProjectFromCredential(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new InvalidApiKeyException("API key required");
        }
        int separator = credential.lastIndexOf(':');
        if (separator <= 0 || separator == credential.length() - 1) {
            throw new InvalidApiKeyException("API key must have the form <apiKey>:<projectId>");
        }
        String apiKey = credential.substring(0, separator);
        String projectId = credential.substring(separator + 1);

        String expected = projectKeyHashes.get(projectId);
        if (expected == null || !MessageDigest.isEqual(
                expected.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII),
                sha256Hex(apiKey).getBytes(StandardCharsets.US_ASCII))) {
            log.warn("Rejected API key for project {}", projectId);
            throw new InvalidApiKeyException("Invalid API key");
        }
        return projectId;
    }

    public static String sha256Hex(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
