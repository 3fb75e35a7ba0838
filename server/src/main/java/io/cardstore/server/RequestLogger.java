package io.cardstore.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request access log.
 *
 * One line per request: method, path, status, latency, and the time spent in
 * the storage backend when the handler touched it. 5xx responses are logged
 * at WARNING with the cause attached.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param storageMillis time spent in CardService, or -1 if not called
     * @param error         cause of a 5xx response, or null
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long storageMillis,
            Throwable error
    ) {
        String msg = String.format(
                "%s %s -> %d in %dms%s",
                method,
                path,
                status,
                totalMillis,
                storageMillis >= 0 ? " (storage " + storageMillis + "ms)" : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.info(msg);
        }
    }
}
