// file: src/main/java/io/cardstore/storage/local/FileHistorySink.java
package io.cardstore.storage.local;

import io.cardstore.core.Document;
import io.cardstore.storage.DocumentCodec;
import io.cardstore.storage.HistorySink;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;

/**
 * History sink writing one JSON file per snapshot.
 * <p>
 * Layout, next to the active data file:
 *   history/cards_<epochMillis>.json
 *   history/cards_<epochMillis>_1.json   (same millisecond, second snapshot)
 * <p>
 * Files are created with CREATE_NEW and never overwritten.
 */
public final class FileHistorySink implements HistorySink {
    static final String DIR_NAME = "history";
    private static final int MAX_SAME_MILLIS = 1000;

    private final Path dir;
    private final Clock clock;

    /** History directory derived from the data file: {@code <dataDir>/history}. */
    public static FileHistorySink besideDataFile(Path dataFile, Clock clock) {
        Path parent = dataFile.toAbsolutePath().getParent();
        return new FileHistorySink(parent.resolve(DIR_NAME), clock);
    }

    public FileHistorySink(Path dir, Clock clock) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Path dir() {
        return dir;
    }

    @Override
    public String append(Document previous) throws IOException {
        Files.createDirectories(dir);
        byte[] bytes = DocumentCodec.encode(previous);
        String base = "cards_" + clock.millis();

        for (int n = 0; n < MAX_SAME_MILLIS; n++) {
            String name = n == 0 ? base + ".json" : base + "_" + n + ".json";
            try {
                Files.write(dir.resolve(name), bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return name;
            } catch (FileAlreadyExistsException taken) {
                // same millisecond as an earlier snapshot: try the next suffix
                continue;
            }
        }
        throw new IOException("too many snapshots for " + base + " in " + dir);
    }
}
