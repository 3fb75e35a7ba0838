// file: src/main/java/io/cardstore/storage/remote/TableClient.java
package io.cardstore.storage.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Transport to a remote key -> payload table.
 * <p>
 * Tables have the shape { key: text, payload: json }. The primary table has a
 * unique constraint on key; history tables are plain append-only logs.
 * <p>
 * All methods throw {@link TableClientException} on any transport or backend
 * error. Whether that error is absorbed or surfaced is the caller's policy.
 */
public interface TableClient {

    /** Payload of the row with 'key', or empty if there is no such row. */
    Optional<JsonNode> fetchPayload(String table, String key);

    /** Insert or replace the row with 'key' (conflict target: key). */
    void upsert(String table, String key, JsonNode payload);

    /** Append a new row. */
    void insert(String table, String key, JsonNode payload);
}
