// file: server/src/main/java/io/cardstore/server/ServerConfig.java
package io.cardstore.server;

import io.cardstore.storage.StorageConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Server configuration: environment variables first, CLI flags override.
 *
 * Supports:
 *  - httpPort:        HTTP API port
 *  - adminSecret:     shared secret expected in X-Admin-Secret
 *  - allowedOrigins:  comma-separated CORS allow-list (empty = all origins)
 *  - dataFile:        primary JSON file for the local backend
 *  - fallbackFile:    file used when dataFile cannot be prepared
 *  - remoteUrl:       base URL of the remote table API (optional)
 *  - remoteKey:       service credential for the remote table API (optional)
 *  - remoteTimeoutSeconds: connect and request timeout for remote calls
 */
public record ServerConfig(
        int httpPort,
        String adminSecret,
        String allowedOrigins,
        String dataFile,
        String fallbackFile,
        String remoteUrl,
        String remoteKey,
        long remoteTimeoutSeconds
) {

    public static final int DEFAULT_PORT = 5175;
    public static final String DEFAULT_ADMIN_SECRET = "changeme";
    public static final String DEFAULT_DATA_FILE = "./data/cards.json";
    public static final long DEFAULT_REMOTE_TIMEOUT_SECONDS = 10;

    /**
     * Resolve configuration from the process environment and the command line.
     *
     * Environment:
     *   PORT, ADMIN_SECRET, ALLOWED_ORIGINS, DATA_FILE, FALLBACK_DATA_FILE,
     *   SUPABASE_URL, SUPABASE_SERVICE_ROLE, REMOTE_TIMEOUT_SECONDS
     *
     * Supported flags:
     *   --port,          -p   <port>
     *   --admin-secret        <secret>
     *   --allowed-origins     <csv>
     *   --data-file,     -d   <path>
     *   --fallback-file       <path>
     *   --remote-url          <url>
     *   --remote-key          <key>
     *   --remote-timeout      <seconds>
     *   --help,          -h
     *
     * @throws IllegalArgumentException on an unknown flag, a missing flag value
     *                                  or an invalid number
     */
    public static ServerConfig fromEnvAndArgs(Map<String, String> env, String[] args) {
        // Defaults, then environment
        int httpPort = parsePort(env.getOrDefault("PORT", String.valueOf(DEFAULT_PORT)), "PORT");
        String adminSecret = nonBlankOr(env.get("ADMIN_SECRET"), DEFAULT_ADMIN_SECRET);
        String allowedOrigins = env.getOrDefault("ALLOWED_ORIGINS", "");
        String dataFile = nonBlankOr(env.get("DATA_FILE"), DEFAULT_DATA_FILE);
        String fallbackFile = nonBlankOr(env.get("FALLBACK_DATA_FILE"), defaultFallbackFile());
        String remoteUrl = env.getOrDefault("SUPABASE_URL", "");
        String remoteKey = env.getOrDefault("SUPABASE_SERVICE_ROLE", "");
        long remoteTimeout = parseTimeout(
                env.getOrDefault("REMOTE_TIMEOUT_SECONDS", String.valueOf(DEFAULT_REMOTE_TIMEOUT_SECONDS)),
                "REMOTE_TIMEOUT_SECONDS");

        // CLIArg Parser
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parsePort(args[++i], "port");
                }

                case "--admin-secret" -> {
                    ensureValue(args, i);
                    adminSecret = args[++i];
                }

                case "--allowed-origins" -> {
                    ensureValue(args, i);
                    allowedOrigins = args[++i];
                }

                case "--data-file", "-d" -> {
                    ensureValue(args, i);
                    dataFile = args[++i];
                }

                case "--fallback-file" -> {
                    ensureValue(args, i);
                    fallbackFile = args[++i];
                }

                case "--remote-url" -> {
                    ensureValue(args, i);
                    remoteUrl = args[++i];
                }

                case "--remote-key" -> {
                    ensureValue(args, i);
                    remoteKey = args[++i];
                }

                case "--remote-timeout" -> {
                    ensureValue(args, i);
                    remoteTimeout = parseTimeout(args[++i], "remote-timeout");
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ServerConfig(
                httpPort,
                adminSecret,
                allowedOrigins,
                dataFile,
                fallbackFile,
                remoteUrl,
                remoteKey,
                remoteTimeout
        );
    }

    /** True when the admin secret was left at its well-known default. */
    public boolean usesDefaultSecret() {
        return DEFAULT_ADMIN_SECRET.equals(adminSecret);
    }

    public StorageConfig toStorageConfig() {
        return new StorageConfig(
                Path.of(dataFile),
                Path.of(fallbackFile),
                remoteUrl,
                remoteKey,
                Duration.ofSeconds(remoteTimeoutSeconds),
                StorageConfig.DEFAULT_DOCUMENT_KEY,
                StorageConfig.DEFAULT_TABLE,
                StorageConfig.DEFAULT_HISTORY_TABLE
        );
    }

    private static String defaultFallbackFile() {
        return Path.of(System.getProperty("java.io.tmpdir"), "cards.json").toString();
    }

    private static String nonBlankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int parsePort(String raw, String name) {
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid " + name + ": " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }

    private static long parseTimeout(String raw, String name) {
        try {
            long seconds = Long.parseLong(raw.trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException("Invalid " + name + ": " + raw);
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --port,           -p   HTTP port (default: 5175, env PORT)
              --admin-secret         Admin secret (default: changeme, env ADMIN_SECRET)
              --allowed-origins      Comma-separated CORS origins (default: all, env ALLOWED_ORIGINS)
              --data-file,      -d   Data file (default: ./data/cards.json, env DATA_FILE)
              --fallback-file        Fallback data file (default: <tmpdir>/cards.json, env FALLBACK_DATA_FILE)
              --remote-url           Remote table API URL (env SUPABASE_URL)
              --remote-key           Remote table API key (env SUPABASE_SERVICE_ROLE)
              --remote-timeout       Remote timeout in seconds (default: 10, env REMOTE_TIMEOUT_SECONDS)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
