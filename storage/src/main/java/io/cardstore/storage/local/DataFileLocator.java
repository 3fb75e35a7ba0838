// file: src/main/java/io/cardstore/storage/local/DataFileLocator.java
package io.cardstore.storage.local;

import io.cardstore.core.Document;
import io.cardstore.storage.DocumentCodec;
import io.cardstore.storage.StartupFatalException;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the data file the local store will use.
 * <p>
 * Steps:
 *  1) Create the parent directory of the primary path (recursively).
 *  2) Seed {version:1, cards:[]} if the file does not exist yet.
 *  3) If 1) or 2) fails, repeat both against the fallback path. The fallback
 *     usually lives in the temp directory and does not survive a host restart.
 *  4) If the fallback fails too, throw {@link StartupFatalException}.
 */
public final class DataFileLocator {
    private static final Logger log = Logger.getLogger(DataFileLocator.class.getName());

    private final Path primary;
    private final Path fallback;

    public DataFileLocator(Path primary, Path fallback) {
        this.primary = Objects.requireNonNull(primary, "primary").toAbsolutePath();
        this.fallback = Objects.requireNonNull(fallback, "fallback").toAbsolutePath();
    }

    /** Where the store ended up, and whether that is the non-durable fallback. */
    public record Prepared(Path dataFile, boolean fallback) {}

    public Prepared prepare() {
        try {
            ensureDataFile(primary);
            log.info("Using data file " + primary);
            return new Prepared(primary, false);
        } catch (IOException e) {
            log.warning(String.format(
                    "Cannot use %s (%s: %s). Falling back to %s",
                    primary.getParent(), e.getClass().getSimpleName(), e.getMessage(), fallback));
        }

        try {
            ensureDataFile(fallback);
            log.warning("Using fallback data file " + fallback + " (NOT persistent across restarts)");
            return new Prepared(fallback, true);
        } catch (IOException e2) {
            log.log(Level.SEVERE, "Could not prepare a data file at " + primary + " or " + fallback, e2);
            throw new StartupFatalException(
                    "no writable location for the data file (tried " + primary + " and " + fallback + ")", e2);
        }
    }

    static void ensureDataFile(Path file) throws IOException {
        Path dir = file.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        if (Files.exists(file)) {
            return;
        }
        try {
            Files.write(file, DocumentCodec.encode(Document.empty()),
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException raced) {
            // Another process seeded it between exists() and write(); that is fine.
            log.fine(() -> "Data file appeared concurrently: " + file);
        }
    }
}
