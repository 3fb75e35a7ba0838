package io.cardstore.storage;

import java.util.Objects;

/**
 * The backend chosen at startup: the live document store plus the snapshot
 * manager writing into the matching history sink.
 */
public record StorageBackend(Kind kind, DocumentStore store, SnapshotManager snapshots) {

    public enum Kind {
        LOCAL, REMOTE;

        public String label() {
            return name().toLowerCase();
        }
    }

    public StorageBackend {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(snapshots, "snapshots");
    }
}
