package com.example.logpipeline.storage;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public enum StorageBackendType {
    POSTGRES("postgres", Set.of("relational", "sqlite")),
    ELASTICSEARCH("elasticsearch", Set.of("search")),
    S3("s3", Set.of("object-store"));

    private final String backendName;
    private final Set<String> aliases;

    StorageBackendType(String backendName, Set<String> aliases) {
        this.backendName = backendName;
        this.aliases = aliases;
    }

    public String backendName() {
        return backendName;
    }

    public static List<String> validNames() {
        return Arrays.stream(values()).map(StorageBackendType::backendName).toList();
    }

    /**
     * Resolves a configured or requested backend name, case-insensitively.
     *
     * @throws UnknownStorageBackendException naming the valid set when nothing matches
     */
    public static StorageBackendType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownStorageBackendException(
                    "Storage backend name is required. Valid options: " + validNames());
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StorageBackendType type : values()) {
            if (type.backendName.equals(normalized) || type.aliases.contains(normalized)) {
                return type;
            }
        }
        throw new UnknownStorageBackendException(
                "Invalid storage backend: " + name + ". Valid options: " + validNames());
    }
}
