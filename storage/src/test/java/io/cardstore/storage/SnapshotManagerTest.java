package io.cardstore.storage;

import io.cardstore.core.Document;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotManagerTest {

    @Test
    void successful_capture_reaches_the_sink() {
        List<Document> recorded = new ArrayList<>();
        var manager = new SnapshotManager(prev -> {
            recorded.add(prev);
            return "snap-" + recorded.size();
        });

        assertTrue(manager.capture(new Document(4, List.of())));
        assertEquals(List.of(new Document(4, List.of())), recorded);
    }

    @Test
    void io_failure_is_swallowed_and_reported_as_false() {
        var manager = new SnapshotManager(prev -> {
            throw new IOException("disk full");
        });

        assertFalse(manager.capture(Document.empty()));
    }

    @Test
    void runtime_failure_is_swallowed_too() {
        var manager = new SnapshotManager(prev -> {
            throw new IllegalStateException("boom");
        });

        assertFalse(assertDoesNotThrow(() -> manager.capture(Document.empty())));
    }
}
