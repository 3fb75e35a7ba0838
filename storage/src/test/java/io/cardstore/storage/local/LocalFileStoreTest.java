package io.cardstore.storage.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardstore.core.Document;
import io.cardstore.storage.WriteFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir Path dir;

    @Test
    void written_document_survives_a_new_store_instance() throws Exception {
        Path file = dir.resolve("cards.json");
        var doc = new Document(7, List.of(MAPPER.readTree("{\"id\":\"a\",\"name\":\"Alpha\"}")));

        new LocalFileStore(file).write(doc);

        // "Restart": a fresh instance reads what the first one wrote.
        assertEquals(doc, new LocalFileStore(file).read());
    }

    @Test
    void file_is_plain_version_and_cards_json() throws Exception {
        Path file = dir.resolve("cards.json");
        new LocalFileStore(file).write(new Document(2, List.of(MAPPER.readTree("{\"id\":\"a\"}"))));

        var root = MAPPER.readTree(Files.readString(file));
        assertEquals(2, root.get("version").asInt());
        assertTrue(root.get("cards").isArray());
        assertEquals("a", root.get("cards").get(0).get("id").asText());
    }

    @Test
    void missing_file_reads_as_default_document() {
        assertEquals(Document.empty(), new LocalFileStore(dir.resolve("nope.json")).read());
    }

    @Test
    void corrupt_file_reads_as_default_document() throws Exception {
        Path file = dir.resolve("cards.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        assertEquals(Document.empty(), new LocalFileStore(file).read());
    }

    @Test
    void file_without_cards_array_reads_with_empty_cards() throws Exception {
        Path file = dir.resolve("cards.json");
        Files.writeString(file, "{\"version\":4,\"cards\":\"oops\"}", StandardCharsets.UTF_8);

        Document d = new LocalFileStore(file).read();
        assertEquals(4, d.version());
        assertTrue(d.cards().isEmpty());
    }

    @Test
    void write_into_missing_directory_fails_with_write_failed() {
        var store = new LocalFileStore(dir.resolve("gone").resolve("cards.json"));

        assertThrows(WriteFailedException.class, () -> store.write(Document.empty()));
    }

    @Test
    void write_leaves_no_temp_files_behind() throws Exception {
        Path file = dir.resolve("cards.json");
        var store = new LocalFileStore(file);
        for (int i = 1; i <= 5; i++) {
            store.write(new Document(i, List.of()));
        }

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void concurrent_reader_never_observes_a_partial_file() throws Exception {
        Path file = dir.resolve("cards.json");
        var store = new LocalFileStore(file);
        var big = MAPPER.readTree("{\"id\":\"big\",\"blob\":\"" + "x".repeat(64 * 1024) + "\"}");
        store.write(new Document(2, List.of(big)));

        AtomicBoolean done = new AtomicBoolean();
        AtomicInteger degraded = new AtomicInteger();
        Thread reader = new Thread(() -> {
            while (!done.get()) {
                // Every stored version is >= 2; a torn file would decode as the default (version 1).
                if (store.read().version() < 2) degraded.incrementAndGet();
            }
        });
        reader.start();
        for (int v = 3; v < 200; v++) {
            store.write(new Document(v, List.of(big)));
        }
        done.set(true);
        reader.join();

        assertEquals(0, degraded.get());
    }
}
