package io.cardstore.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardstore.core.CardMerger;
import io.cardstore.core.Document;
import io.cardstore.storage.DocumentStore;
import io.cardstore.storage.SnapshotManager;
import io.cardstore.storage.WriteFailedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for the cards document.
 *
 * Responsibilities:
 *  - Hide the active backend (file or remote table) from the HTTP layer.
 *  - Gate mutations on the admin secret and on the body shape, before any I/O.
 *  - Run each mutation as: read current -> (merge) -> snapshot current -> write.
 *
 * Concurrency:
 *  - Mutations are NOT serialized. Two overlapping upserts may both read the
 *    same current document, and the later write wins (lost update). The
 *    version then advances by one for two logical updates.
 */
public class CardService {
    private static final Logger log = Logger.getLogger(CardService.class.getName());

    /** Largest version a document may carry; upsert needs room for +1. */
    static final long MAX_VERSION = Long.MAX_VALUE;

    private final DocumentStore store;
    private final SnapshotManager snapshots;
    private final CardMerger merger;
    private final AdminAuthenticator auth;

    public CardService(DocumentStore store, SnapshotManager snapshots, CardMerger merger, AdminAuthenticator auth) {
        this.store = Objects.requireNonNull(store, "store");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.auth = Objects.requireNonNull(auth, "auth");
    }

    /**
     * Current document. Never fails: any backend problem yields the default
     * document.
     */
    public Document getDocument() {
        try {
            return store.read();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Read failed unexpectedly, serving default document", e);
            return Document.empty();
        }
    }

    /**
     * Replace the whole document.
     *
     * Steps:
     *  1) Check credential, then body: {cards: [...], version?: n}.
     *  2) Read the current document.
     *  3) Snapshot it (best-effort).
     *  4) Write {version: body.version or 1, cards: body.cards}.
     */
    public MutationResult replace(String credential, JsonNode body) {
        if (!auth.isAdmin(credential)) return MutationResult.of(MutationResult.Status.UNAUTHORIZED);
        List<JsonNode> cards = cardsOf(body);
        if (cards == null) return MutationResult.of(MutationResult.Status.INVALID_BODY);
        long version = replaceVersionOf(body.get("version"));
        if (version < 1) return MutationResult.of(MutationResult.Status.INVALID_BODY);

        Document next = new Document(version, cards);
        Document prev = store.read();
        snapshots.capture(prev);
        try {
            store.write(next);
        } catch (WriteFailedException e) {
            log.log(Level.SEVERE, "Replace failed", e);
            return MutationResult.of(MutationResult.Status.WRITE_FAILED);
        }
        log.info(String.format("Replaced document: version %d -> %d (%d cards)",
                prev.version(), next.version(), next.size()));
        return MutationResult.ok(next.version(), cards.size());
    }

    /**
     * Merge incoming cards into the document by id.
     *
     * Steps:
     *  1) Check credential, then body: {cards: [...]}.
     *  2) Read the current document.
     *  3) merged = merger.merge(current.cards, body.cards).
     *  4) next = {version: current.version + 1, cards: merged}.
     *  5) Snapshot current (best-effort), then write next.
     *
     * The "updated" count is the number of incoming records, anonymous ones included.
     */
    public MutationResult upsert(String credential, JsonNode body) {
        if (!auth.isAdmin(credential)) return MutationResult.of(MutationResult.Status.UNAUTHORIZED);
        List<JsonNode> incoming = cardsOf(body);
        if (incoming == null) return MutationResult.of(MutationResult.Status.INVALID_BODY);

        Document prev = store.read();
        if (prev.version() >= MAX_VERSION) {
            log.severe("Upsert refused: stored version " + prev.version() + " cannot be incremented");
            return MutationResult.of(MutationResult.Status.WRITE_FAILED);
        }
        List<JsonNode> merged = merger.merge(prev.cards(), incoming);
        Document next = new Document(prev.version() + 1, merged);

        snapshots.capture(prev);
        try {
            store.write(next);
        } catch (WriteFailedException e) {
            log.log(Level.SEVERE, "Upsert failed", e);
            return MutationResult.of(MutationResult.Status.WRITE_FAILED);
        }
        log.info(String.format("Upserted %d cards: version %d -> %d (%d cards)",
                incoming.size(), prev.version(), next.version(), next.size()));
        return MutationResult.ok(next.version(), incoming.size());
    }

    // ------------ helpers ------------

    /** body.cards as a list, or null if the body is not {cards: [...]}. */
    private static List<JsonNode> cardsOf(JsonNode body) {
        if (body == null || !body.isObject()) return null;
        JsonNode cards = body.get("cards");
        if (cards == null || !cards.isArray()) return null;
        List<JsonNode> out = new ArrayList<>(cards.size());
        cards.forEach(out::add);
        return out;
    }

    /**
     * Caller-supplied version for a replace.
     * Absent or "falsy" (null, false, 0, "") -> 1. Positive integers below
     * MAX_VERSION and their string forms are taken as-is. Anything else
     * returns -1 (invalid body).
     */
    static long replaceVersionOf(JsonNode v) {
        if (v == null || v.isNull()) return 1;
        if (v.isBoolean()) return 1;
        if (v.isNumber()) {
            if (v.decimalValue().signum() == 0) return 1;
            if (!v.isIntegralNumber() && v.decimalValue().stripTrailingZeros().scale() > 0) return -1;
            if (!v.canConvertToLong()) return -1;
            return bounded(v.asLong());
        }
        if (v.isTextual()) {
            String s = v.textValue().trim();
            if (s.isEmpty()) return 1;
            try {
                return bounded(Long.parseLong(s));
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    private static long bounded(long n) {
        return n >= 1 && n < MAX_VERSION ? n : -1;
    }
}
