package io.cardstore.storage;

/**
 * Persisting the primary document failed. Always surfaced to the caller of the
 * mutation that attempted the write.
 */
public class WriteFailedException extends Exception {

    public WriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
