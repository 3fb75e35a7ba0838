// file: src/main/java/io/cardstore/storage/remote/RemoteTableStore.java
package io.cardstore.storage.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardstore.core.Document;
import io.cardstore.storage.DocumentCodec;
import io.cardstore.storage.DocumentStore;
import io.cardstore.storage.WriteFailedException;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Document store backed by one row of a remote key -> payload table.
 * <p>
 * Error policy:
 *  - read: a missing row, a transport error or an undecodable payload all
 *    yield the default document. Errors are logged, never thrown.
 *  - write: any error becomes {@link WriteFailedException}.
 */
public final class RemoteTableStore implements DocumentStore {
    private static final Logger log = Logger.getLogger(RemoteTableStore.class.getName());

    private final TableClient client;
    private final String table;
    private final String documentKey;

    public RemoteTableStore(TableClient client, String table, String documentKey) {
        this.client = Objects.requireNonNull(client, "client");
        this.table = Objects.requireNonNull(table, "table");
        this.documentKey = Objects.requireNonNull(documentKey, "documentKey");
    }

    @Override
    public Document read() {
        try {
            Optional<JsonNode> payload = client.fetchPayload(table, documentKey);
            if (payload.isEmpty()) {
                return Document.empty();
            }
            return DocumentCodec.fromJson(payload.get());
        } catch (Exception e) {
            log.log(Level.WARNING, "Remote read of " + table + "/" + documentKey
                    + " failed, serving default document", e);
            return Document.empty();
        }
    }

    @Override
    public void write(Document doc) throws WriteFailedException {
        Objects.requireNonNull(doc, "doc");
        try {
            client.upsert(table, documentKey, DocumentCodec.toJson(doc));
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Remote write of " + table + "/" + documentKey + " failed", e);
            throw new WriteFailedException("remote write failed", e);
        }
    }

    @Override
    public String describe() {
        return "table:" + table + "/" + documentKey;
    }
}
