package io.cardstore.storage;

import io.cardstore.core.Document;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Captures the document as it was immediately before a mutation.
 * <p>
 * Capturing is best-effort: a failing sink is logged and ignored so that it
 * never aborts the enclosing write.
 */
public final class SnapshotManager {
    private static final Logger log = Logger.getLogger(SnapshotManager.class.getName());

    private final HistorySink sink;

    public SnapshotManager(HistorySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Append 'previous' to the history sink.
     *
     * @return true if the snapshot was recorded, false if it failed (already logged)
     */
    public boolean capture(Document previous) {
        try {
            String id = sink.append(previous);
            log.fine(() -> "Snapshot recorded: " + id + " (version " + previous.version() + ")");
            return true;
        } catch (Exception e) {
            log.log(Level.WARNING, "Snapshot write failed (ignored): " + e.getMessage(), e);
            return false;
        }
    }
}
