// file: src/main/java/io/cardstore/storage/local/LocalFileStore.java
package io.cardstore.storage.local;

import io.cardstore.core.Document;
import io.cardstore.storage.DocumentCodec;
import io.cardstore.storage.DocumentStore;
import io.cardstore.storage.WriteFailedException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Document store backed by a single JSON file.
 * <p>
 * Atomicity:
 *   - We write to a temp file in the same directory first,
 *   - then move it over the data file using ATOMIC_MOVE,
 *   so a concurrent reader sees either the old or the new document, never a
 *   torn one. Filesystems without atomic rename get a plain replace.
 */
public final class LocalFileStore implements DocumentStore {
    private static final Logger log = Logger.getLogger(LocalFileStore.class.getName());

    private final Path dataFile;

    /**
     * @param dataFile a prepared data file, see {@link DataFileLocator}
     */
    public LocalFileStore(Path dataFile) {
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile").toAbsolutePath();
    }

    public Path dataFile() {
        return dataFile;
    }

    @Override
    public Document read() {
        try {
            return DocumentCodec.decode(Files.readAllBytes(dataFile));
        } catch (IOException | RuntimeException e) {
            log.log(Level.WARNING, "Read of " + dataFile + " failed, serving default document: " + e.getMessage());
            return Document.empty();
        }
    }

    @Override
    public void write(Document doc) throws WriteFailedException {
        Objects.requireNonNull(doc, "doc");
        Path tmp = null;
        try {
            byte[] bytes = DocumentCodec.encode(doc);
            tmp = Files.createTempFile(dataFile.getParent(), dataFile.getFileName() + ".", ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, dataFile, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, dataFile, REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException | RuntimeException e) {
            throw new WriteFailedException("write of " + dataFile + " failed", e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    @Override
    public String describe() {
        return "file:" + dataFile;
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.log(Level.FINE, "Could not remove temp file " + tmp, e);
        }
    }
}
