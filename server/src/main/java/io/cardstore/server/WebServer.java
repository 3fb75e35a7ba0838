package io.cardstore.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardstore.core.Document;
import io.cardstore.server.dto.HealthResponse;
import io.cardstore.server.dto.MutationResponse;
import io.cardstore.storage.DocumentCodec;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin HTTP adapter over CardService.
 *
 * Responsibilities:
 *  - Enforce the CORS origin allow-list and answer preflights.
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies and extract the admin secret header.
 *  - Convert service results back into JSON and HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /                 Plain-text banner
 *   - GET    /cards            Current document (never cached)
 *   - PUT    /cards            Full replace          (X-Admin-Secret)
 *   - POST   /cards/upsert     Merge by card id      (X-Admin-Secret)
 *   - GET    /admin/health     Health + active backend
 *   - OPTIONS *                CORS preflight
 *
 * Handlers run on worker threads: the backend may block on disk or network.
 */
public final class WebServer {
    private static final Logger log = Logger.getLogger(WebServer.class.getName());

    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    static final HttpString ADMIN_SECRET = new HttpString("X-Admin-Secret");
    private static final HttpString ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString ALLOW_CREDENTIALS = new HttpString("Access-Control-Allow-Credentials");
    private static final HttpString ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final CardService cards;
    private final CorsPolicy cors;
    private final String backendLabel;

    public WebServer(int port, CardService cards, CorsPolicy cors, String backendLabel) {
        this.cards = Objects.requireNonNull(cards, "cards");
        this.cors = Objects.requireNonNull(cors, "cors");
        this.backendLabel = Objects.requireNonNull(backendLabel, "backendLabel");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::route);
            return;
        }

        String path = normalize(exchange.getRequestPath());
        String method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        String origin = exchange.getRequestHeaders().getFirst(Headers.ORIGIN);
        if (!cors.allows(origin)) {
            send(exchange, 403, Map.of("error", "origin not allowed"));
            RequestLogger.logRequest(method, path, 403, 0, -1, null);
            return;
        }
        applyCorsHeaders(exchange, origin);

        if ("OPTIONS".equals(method)) {
            exchange.getResponseHeaders().put(ALLOW_METHODS, CorsPolicy.ALLOWED_METHODS);
            exchange.getResponseHeaders().put(ALLOW_HEADERS, CorsPolicy.ALLOWED_HEADERS);
            exchange.getResponseHeaders().remove(Headers.CONTENT_TYPE);
            exchange.setStatusCode(204);
            exchange.endExchange();
            RequestLogger.logRequest(method, path, 204, 0, -1, null);
            return;
        }

        switch (path) {
            case "/" -> {
                if ("GET".equals(method)) {
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                    exchange.getResponseSender().send("OK. Use /cards to read or save the configuration.");
                    RequestLogger.logRequest(method, path, 200, 0, -1, null);
                } else {
                    methodNotAllowed(exchange, method, path);
                }
            }
            case "/cards" -> {
                switch (method) {
                    case "GET" -> handleGetCards(exchange);
                    case "PUT" -> handleMutation(exchange, false);
                    default -> methodNotAllowed(exchange, method, path);
                }
            }
            case "/cards/upsert" -> {
                if ("POST".equals(method)) {
                    handleMutation(exchange, true);
                } else {
                    methodNotAllowed(exchange, method, path);
                }
            }
            case "/admin/health" -> {
                if ("GET".equals(method)) {
                    var dto = new HealthResponse();
                    dto.status = "ok";
                    dto.backend = backendLabel;
                    send(exchange, 200, dto);
                    RequestLogger.logRequest(method, path, 200, 0, -1, null);
                } else {
                    methodNotAllowed(exchange, method, path);
                }
            }
            default -> {
                send(exchange, 404, Map.of("error", "not found"));
                RequestLogger.logRequest(method, path, 404, 0, -1, null);
            }
        }
    }

    // ---------- handlers ----------

    /** GET /cards */
    private void handleGetCards(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long storageMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Document doc = cards.getDocument();
            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

            ex.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
            send(ex, status, DocumentCodec.toJson(doc));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", "read_failed"));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, storageMs, error);
        }
    }

    /** PUT /cards (replace) and POST /cards/upsert (upsert). */
    private void handleMutation(HttpServerExchange ex, boolean upsert) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    long storageMs = -1L;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            send(exchange, 413, Map.of("error", "request body too large"));
                        } else {
                            String credential = exchange.getRequestHeaders().getFirst(ADMIN_SECRET);
                            JsonNode body = isJson(exchange.getRequestHeaders().getFirst(Headers.CONTENT_TYPE))
                                    ? parseBody(data)
                                    : null;

                            long sStart = System.nanoTime();
                            MutationResult r = upsert
                                    ? cards.upsert(credential, body)
                                    : cards.replace(credential, body);
                            storageMs = (System.nanoTime() - sStart) / 1_000_000L;

                            sendResult(exchange, r, upsert);
                        }
                    } catch (Exception e) {
                        error = e;
                        send(exchange, 500, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        RequestLogger.logRequest(method, path, exchange.getStatusCode(), totalMs, storageMs, error);
                    }
                },
                (exchange, ioEx) -> {
                    String method = exchange.getRequestMethod().toString();
                    String path = exchange.getRequestPath();
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, path, status, 0, -1, ioEx);
                }
        );
    }

    // ---------- helpers ----------

    private void sendResult(HttpServerExchange ex, MutationResult r, boolean upsert) {
        switch (r.status()) {
            case OK -> {
                var dto = new MutationResponse();
                dto.ok = true;
                if (upsert) {
                    dto.version = r.version();
                    dto.updated = r.updated();
                }
                send(ex, 200, dto);
            }
            case UNAUTHORIZED -> send(ex, 401, Map.of("error", "unauthorized"));
            case INVALID_BODY -> send(ex, 400, Map.of("error", "invalid_body"));
            case WRITE_FAILED -> send(ex, 500, Map.of("error", "write_failed"));
        }
    }

    /** True for "application/json", parameters such as charset ignored. */
    static boolean isJson(String contentType) {
        if (contentType == null) {
            return false;
        }
        int semi = contentType.indexOf(';');
        String mime = (semi < 0 ? contentType : contentType.substring(0, semi)).trim();
        return "application/json".equalsIgnoreCase(mime);
    }

    /** Parsed JSON body, or null when empty or not valid JSON (the service rejects it). */
    private JsonNode parseBody(byte[] data) throws IOException {
        if (data.length == 0) {
            return null;
        }
        try {
            return json.readTree(data);
        } catch (JsonProcessingException e) {
            log.fine(() -> "Unparseable JSON body: " + e.getOriginalMessage());
            return null;
        }
    }

    private void applyCorsHeaders(HttpServerExchange ex, String origin) {
        if (origin == null || origin.isEmpty()) {
            return;
        }
        ex.getResponseHeaders().put(ALLOW_ORIGIN, origin);
        ex.getResponseHeaders().put(ALLOW_CREDENTIALS, "true");
        ex.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    private static String normalize(String path) {
        if (path.length() > 1 && path.endsWith("/")) {
            return path.substring(0, path.length() - 1);
        }
        return path;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.log(Level.WARNING, "Response serialization failed", e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
