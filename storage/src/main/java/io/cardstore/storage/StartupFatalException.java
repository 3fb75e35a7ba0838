package io.cardstore.storage;

/**
 * No usable storage location could be prepared. The process must not start.
 */
public class StartupFatalException extends RuntimeException {

    public StartupFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
