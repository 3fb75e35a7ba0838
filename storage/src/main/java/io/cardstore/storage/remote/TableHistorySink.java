package io.cardstore.storage.remote;

import io.cardstore.core.Document;
import io.cardstore.storage.DocumentCodec;
import io.cardstore.storage.HistorySink;

import java.io.IOException;
import java.util.Objects;

/** History sink appending { key, payload } rows to a remote history table. */
public final class TableHistorySink implements HistorySink {

    private final TableClient client;
    private final String historyTable;
    private final String documentKey;

    public TableHistorySink(TableClient client, String historyTable, String documentKey) {
        this.client = Objects.requireNonNull(client, "client");
        this.historyTable = Objects.requireNonNull(historyTable, "historyTable");
        this.documentKey = Objects.requireNonNull(documentKey, "documentKey");
    }

    @Override
    public String append(Document previous) throws IOException {
        try {
            client.insert(historyTable, documentKey, DocumentCodec.toJson(previous));
            return historyTable + "/" + documentKey + "@" + previous.version();
        } catch (TableClientException e) {
            throw new IOException("history insert into " + historyTable + " failed", e);
        }
    }
}
