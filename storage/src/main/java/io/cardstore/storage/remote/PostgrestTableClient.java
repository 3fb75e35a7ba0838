// file: src/main/java/io/cardstore/storage/remote/PostgrestTableClient.java
package io.cardstore.storage.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * HTTP-based TableClient for a PostgREST endpoint (e.g. a Supabase project).
 *
 * Requests, relative to {baseUrl}/rest/v1:
 *
 *   GET  /{table}?select=payload&key=eq.{key}&limit=1
 *        -> [ { "payload": {...} } ]  or  []
 *
 *   POST /{table}?on_conflict=key
 *        Prefer: resolution=merge-duplicates,return=minimal
 *        [ { "key": "...", "payload": {...} } ]
 *
 *   POST /{table}
 *        Prefer: return=minimal
 *        { "key": "...", "payload": {...} }
 *
 * The service credential is sent both as "apikey" and as a Bearer token.
 */
public final class PostgrestTableClient implements TableClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String restBase;
    private final String serviceKey;
    private final Duration timeout;
    private final HttpClient client;

    public PostgrestTableClient(String baseUrl, String serviceKey, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.serviceKey = Objects.requireNonNull(serviceKey, "serviceKey");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.restBase = trimmed + "/rest/v1/";
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Optional<JsonNode> fetchPayload(String table, String key) {
        String query = "select=payload&key=" + encode("eq." + key) + "&limit=1";
        HttpRequest req = request(table, query)
                .header("Accept", "application/json")
                .GET()
                .build();

        String body = send(req, table);
        try {
            JsonNode rows = MAPPER.readTree(body);
            if (rows == null || !rows.isArray() || rows.isEmpty()) {
                return Optional.empty();
            }
            JsonNode payload = rows.get(0).get("payload");
            if (payload == null || payload.isNull()) {
                return Optional.empty();
            }
            return Optional.of(payload);
        } catch (IOException e) {
            throw new TableClientException("Unreadable response from table " + table, e);
        }
    }

    @Override
    public void upsert(String table, String key, JsonNode payload) {
        ArrayNode rows = MAPPER.createArrayNode();
        rows.add(row(key, payload));
        HttpRequest req = request(table, "on_conflict=key")
                .header("Content-Type", "application/json")
                .header("Prefer", "resolution=merge-duplicates,return=minimal")
                .POST(HttpRequest.BodyPublishers.ofString(rows.toString()))
                .build();
        send(req, table);
    }

    @Override
    public void insert(String table, String key, JsonNode payload) {
        HttpRequest req = request(table, null)
                .header("Content-Type", "application/json")
                .header("Prefer", "return=minimal")
                .POST(HttpRequest.BodyPublishers.ofString(row(key, payload).toString()))
                .build();
        send(req, table);
    }

    // ---------- helpers ----------

    private HttpRequest.Builder request(String table, String query) {
        String uri = restBase + encode(table) + (query == null ? "" : "?" + query);
        return HttpRequest.newBuilder(URI.create(uri))
                .timeout(timeout)
                .header("apikey", serviceKey)
                .header("Authorization", "Bearer " + serviceKey);
    }

    private String send(HttpRequest req, String table) {
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = resp.statusCode();
            if (status < 200 || status >= 300) {
                throw new TableClientException(
                        req.method() + " " + table + " returned HTTP " + status + ": " + resp.body());
            }
            return resp.body();
        } catch (IOException e) {
            throw new TableClientException(req.method() + " " + table + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TableClientException(req.method() + " " + table + " interrupted", e);
        }
    }

    private static ObjectNode row(String key, JsonNode payload) {
        ObjectNode row = MAPPER.createObjectNode();
        row.put("key", key);
        row.set("payload", payload);
        return row;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
