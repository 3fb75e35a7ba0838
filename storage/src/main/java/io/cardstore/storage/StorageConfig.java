// file: src/main/java/io/cardstore/storage/StorageConfig.java
package io.cardstore.storage;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Storage settings, built once at startup and handed to {@link BackendSelector}.
 *
 * Supports:
 *  - dataFile:      primary JSON file for the local backend
 *  - fallbackFile:  non-durable file used when dataFile cannot be prepared
 *  - remoteUrl:     base URL of the remote table API (blank -> local backend)
 *  - remoteKey:     service credential for the remote API (blank -> local backend)
 *  - remoteTimeout: connect and request timeout for remote calls
 *  - documentKey:   logical name of the single document
 *  - table:         remote table holding the live document
 *  - historyTable:  remote append-only table for snapshots
 */
public record StorageConfig(
        Path dataFile,
        Path fallbackFile,
        String remoteUrl,
        String remoteKey,
        Duration remoteTimeout,
        String documentKey,
        String table,
        String historyTable
) {
    public static final String DEFAULT_DOCUMENT_KEY = "cards";
    public static final String DEFAULT_TABLE = "configs";
    public static final String DEFAULT_HISTORY_TABLE = "configs_history";

    public StorageConfig {
        Objects.requireNonNull(dataFile, "dataFile");
        Objects.requireNonNull(fallbackFile, "fallbackFile");
        Objects.requireNonNull(remoteTimeout, "remoteTimeout");
        Objects.requireNonNull(documentKey, "documentKey");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(historyTable, "historyTable");
        remoteUrl = remoteUrl == null ? "" : remoteUrl.trim();
        remoteKey = remoteKey == null ? "" : remoteKey.trim();
        if (remoteTimeout.isNegative() || remoteTimeout.isZero()) {
            throw new IllegalArgumentException("remoteTimeout must be > 0");
        }
    }

    /** Local-only config with the default names. */
    public static StorageConfig local(Path dataFile, Path fallbackFile) {
        return new StorageConfig(dataFile, fallbackFile, "", "", Duration.ofSeconds(10),
                DEFAULT_DOCUMENT_KEY, DEFAULT_TABLE, DEFAULT_HISTORY_TABLE);
    }

    /** True when both remote endpoint and credential are present. */
    public boolean remoteConfigured() {
        return !remoteUrl.isEmpty() && !remoteKey.isEmpty();
    }
}
