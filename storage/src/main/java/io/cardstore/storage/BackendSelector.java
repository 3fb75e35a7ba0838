// file: src/main/java/io/cardstore/storage/BackendSelector.java
package io.cardstore.storage;

import io.cardstore.storage.local.DataFileLocator;
import io.cardstore.storage.local.FileHistorySink;
import io.cardstore.storage.local.LocalFileStore;
import io.cardstore.storage.remote.PostgrestTableClient;
import io.cardstore.storage.remote.RemoteTableStore;
import io.cardstore.storage.remote.TableClient;
import io.cardstore.storage.remote.TableHistorySink;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Picks the storage backend once, at startup.
 * <p>
 * Rule:
 *  - remote URL and remote credential both non-blank -> remote table backend,
 *  - otherwise -> local file backend (primary path, then fallback path).
 * <p>
 * The result is immutable; there is no runtime switching between backends.
 */
public final class BackendSelector {
    private static final Logger log = Logger.getLogger(BackendSelector.class.getName());

    private final Clock clock;
    private final Function<StorageConfig, TableClient> tableClientFactory;

    public BackendSelector() {
        this(Clock.systemUTC(), cfg -> new PostgrestTableClient(cfg.remoteUrl(), cfg.remoteKey(), cfg.remoteTimeout()));
    }

    /**
     * @param clock              clock used for history file names
     * @param tableClientFactory builds the remote transport from the config
     */
    public BackendSelector(Clock clock, Function<StorageConfig, TableClient> tableClientFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tableClientFactory = Objects.requireNonNull(tableClientFactory, "tableClientFactory");
    }

    /**
     * @throws StartupFatalException if the local backend is chosen and no data
     *                               file location can be prepared
     */
    public StorageBackend select(StorageConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        StorageBackend backend = cfg.remoteConfigured() ? remote(cfg) : local(cfg);
        log.info("Storage backend: " + backend.kind().label() + " (" + backend.store().describe() + ")");
        return backend;
    }

    private StorageBackend remote(StorageConfig cfg) {
        TableClient client = tableClientFactory.apply(cfg);
        var store = new RemoteTableStore(client, cfg.table(), cfg.documentKey());
        var history = new TableHistorySink(client, cfg.historyTable(), cfg.documentKey());
        return new StorageBackend(StorageBackend.Kind.REMOTE, store, new SnapshotManager(history));
    }

    private StorageBackend local(StorageConfig cfg) {
        DataFileLocator.Prepared prepared = new DataFileLocator(cfg.dataFile(), cfg.fallbackFile()).prepare();
        var store = new LocalFileStore(prepared.dataFile());
        var history = FileHistorySink.besideDataFile(prepared.dataFile(), clock);
        return new StorageBackend(StorageBackend.Kind.LOCAL, store, new SnapshotManager(history));
    }
}
