package io.cardstore.server;

import java.util.Objects;

/**
 * Shared-secret admin check.
 * <p>
 * The presented credential must equal the configured secret exactly. A
 * missing credential is treated as the empty string, which never matches a
 * non-empty secret.
 */
public final class AdminAuthenticator {

    private final String secret;

    public AdminAuthenticator(String secret) {
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    public boolean isAdmin(String presented) {
        String candidate = presented == null ? "" : presented;
        return secret.equals(candidate);
    }
}
