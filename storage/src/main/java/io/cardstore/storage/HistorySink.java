// file: src/main/java/io/cardstore/storage/HistorySink.java
package io.cardstore.storage;

import io.cardstore.core.Document;

import java.io.IOException;

/**
 * Append-only destination for pre-mutation snapshots.
 * <p>
 * Every append creates a new, uniquely identified record. Records are never
 * updated or deleted, and nothing in this codebase reads them back.
 */
public interface HistorySink {

    /**
     * Persist 'previous' as a new history record.
     *
     * @return snapshot identifier (file name, table name, ...)
     * @throws IOException if the record could not be written
     */
    String append(Document previous) throws IOException;
}
