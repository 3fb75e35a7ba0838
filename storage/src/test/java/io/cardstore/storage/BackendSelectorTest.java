package io.cardstore.storage;

import io.cardstore.core.Document;
import io.cardstore.storage.remote.InMemoryTableClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackendSelectorTest {

    @TempDir Path dir;

    private StorageConfig config(String url, String key) {
        return new StorageConfig(
                dir.resolve("data/cards.json"),
                dir.resolve("fallback/cards.json"),
                url,
                key,
                Duration.ofSeconds(5),
                StorageConfig.DEFAULT_DOCUMENT_KEY,
                StorageConfig.DEFAULT_TABLE,
                StorageConfig.DEFAULT_HISTORY_TABLE);
    }

    @Test
    void remote_backend_when_url_and_key_are_present() throws Exception {
        var client = new InMemoryTableClient();
        var selector = new BackendSelector(Clock.systemUTC(), cfg -> client);

        StorageBackend backend = selector.select(config("https://example.supabase.co", "service-role"));

        assertEquals(StorageBackend.Kind.REMOTE, backend.kind());
        backend.store().write(new Document(2, java.util.List.of()));
        assertEquals(2, client.row("configs", "cards").get("version").asInt());
        assertTrue(backend.snapshots().capture(Document.empty()));
        assertEquals(1, client.appended("configs_history").size());
        // The local file is never prepared in remote mode.
        assertFalse(Files.exists(dir.resolve("data")));
    }

    @Test
    void local_backend_when_either_remote_setting_is_blank() {
        AtomicInteger factoryCalls = new AtomicInteger();
        var selector = new BackendSelector(Clock.systemUTC(), cfg -> {
            factoryCalls.incrementAndGet();
            return new InMemoryTableClient();
        });

        assertEquals(StorageBackend.Kind.LOCAL, selector.select(config("https://x.supabase.co", "")).kind());
        assertEquals(StorageBackend.Kind.LOCAL, selector.select(config("", "service-role")).kind());
        assertEquals(StorageBackend.Kind.LOCAL, selector.select(config("  ", "  ")).kind());
        assertEquals(0, factoryCalls.get());
    }

    @Test
    void local_backend_seeds_data_file_and_writes_history_beside_it() throws Exception {
        StorageBackend backend = new BackendSelector().select(config(null, null));

        assertTrue(Files.exists(dir.resolve("data/cards.json")));
        assertEquals(Document.empty(), backend.store().read());

        assertTrue(backend.snapshots().capture(Document.empty()));
        try (var files = Files.list(dir.resolve("data/history"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void local_backend_uses_fallback_when_primary_is_unusable() throws Exception {
        Files.writeString(dir.resolve("data"), "blocker");

        StorageBackend backend = new BackendSelector().select(config("", ""));

        assertEquals(StorageBackend.Kind.LOCAL, backend.kind());
        assertTrue(backend.store().describe().endsWith("cards.json"));
        assertTrue(backend.store().describe().contains("fallback"));
        backend.store().write(new Document(3, java.util.List.of()));
        assertEquals(3, backend.store().read().version());
    }
}
