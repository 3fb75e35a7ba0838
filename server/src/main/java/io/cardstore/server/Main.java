// file: server/src/main/java/io/cardstore/server/Main.java
package io.cardstore.server;

import io.cardstore.core.IdKeyedCardMerger;
import io.cardstore.storage.BackendSelector;
import io.cardstore.storage.StartupFatalException;
import io.cardstore.storage.StorageBackend;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the cards server.
 *
 * Responsibilities:
 *  - Resolve configuration from the environment and CLI.
 *  - Select the storage backend (remote table or local file) once.
 *  - Create CardService and WebServer.
 *  - Start the HTTP server and stop it on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        ServerConfig cfg;
        try {
            cfg = ServerConfig.fromEnvAndArgs(System.getenv(), args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        if (cfg.usesDefaultSecret()) {
            log.warning("ADMIN_SECRET is not set; using the default secret. Set ADMIN_SECRET before exposing this server.");
        }

        // ------ Storage Layer -------
        StorageBackend backend;
        try {
            backend = new BackendSelector().select(cfg.toStorageConfig());
        } catch (StartupFatalException e) {
            log.log(Level.SEVERE, "Cannot start: no usable data file", e);
            System.exit(1);
            return;
        }

        // ------ Service + HTTP layer ------
        var service = new CardService(
                backend.store(),
                backend.snapshots(),
                new IdKeyedCardMerger(),
                new AdminAuthenticator(cfg.adminSecret())
        );
        var cors = CorsPolicy.fromCsv(cfg.allowedOrigins());
        var web = new WebServer(cfg.httpPort(), service, cors, backend.kind().label());

        web.start();
        log.info(String.format("Server listening on http://localhost:%d (backend: %s, origins: %s)",
                cfg.httpPort(),
                backend.kind().label(),
                cors.allowedOrigins().isEmpty() ? "*" : String.join(",", cors.allowedOrigins())));

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            web.stop();
        }));
    }
}
