package io.cardstore.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminAuthenticatorTest {

    @Test
    void only_exact_secret_is_admin() {
        var auth = new AdminAuthenticator("s3cret");

        assertTrue(auth.isAdmin("s3cret"));
        assertFalse(auth.isAdmin("S3CRET"));
        assertFalse(auth.isAdmin("s3cret "));
        assertFalse(auth.isAdmin(""));
        assertFalse(auth.isAdmin(null));
    }
}
