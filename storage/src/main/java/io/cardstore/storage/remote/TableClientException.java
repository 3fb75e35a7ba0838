package io.cardstore.storage.remote;

/** A remote table call failed (transport error or non-2xx response). */
public class TableClientException extends RuntimeException {

    public TableClientException(String message) {
        super(message);
    }

    public TableClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
