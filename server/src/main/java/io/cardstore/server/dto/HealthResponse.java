package io.cardstore.server.dto;

/**
 * JSON response for GET /admin/health.
 *   { "status": "ok", "backend": "local" }
 */
public class HealthResponse {
    public String status;
    public String backend;
}
