package io.cardstore.server;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Origin allow-list for browser clients.
 *
 * Rules:
 *  - No Origin header (curl, server-to-server): allowed.
 *  - Empty allow-list: every origin allowed.
 *  - Otherwise the origin must match an entry exactly.
 */
public final class CorsPolicy {

    public static final String ALLOWED_METHODS = "GET, POST, PUT, OPTIONS";
    public static final String ALLOWED_HEADERS =
            "Content-Type, X-Requested-With, Authorization, X-Admin-Secret, Accept";

    private final List<String> allowedOrigins;

    public CorsPolicy(List<String> allowedOrigins) {
        this.allowedOrigins = List.copyOf(Objects.requireNonNull(allowedOrigins, "allowedOrigins"));
    }

    /** Parse "https://a.example, https://b.example" (blank entries dropped). */
    public static CorsPolicy fromCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return new CorsPolicy(List.of());
        }
        return new CorsPolicy(Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
    }

    public List<String> allowedOrigins() {
        return allowedOrigins;
    }

    public boolean allows(String origin) {
        if (origin == null || origin.isEmpty()) return true;
        return allowedOrigins.isEmpty() || allowedOrigins.contains(origin);
    }
}
