// file: src/main/java/io/cardstore/storage/DocumentStore.java
package io.cardstore.storage;

import io.cardstore.core.Document;

/**
 * Minimal synchronous persistence interface for the single cards document.
 * <p>
 * Semantics:
 *  - read() is best-effort: it never throws. Any access or decode failure is
 *    logged and the default document ({version:1, cards:[]}) is returned.
 *  - write() replaces the stored document entirely and either succeeds or
 *    throws {@link WriteFailedException}. There are no retries.
 *  - Neither call takes a lock spanning a read and a later write; callers
 *    doing read-modify-write can race.
 */
public interface DocumentStore {

    /** Current document, or {@link Document#empty()} if absent or unreadable. */
    Document read();

    /** Overwrite the stored document. */
    void write(Document doc) throws WriteFailedException;

    /** Short description of where documents live, for logs and health output. */
    String describe();
}
