// file: src/main/java/io/cardstore/core/Document.java
package io.cardstore.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable envelope for the single versioned configuration document.
 * <p>
 * Fields:
 *  - version:  positive counter, bumped by upserts and set by full replaces.
 *  - cards:    ordered list of configuration records (arbitrary JSON values).
 * <p>
 * Invariants:
 *  - cards is never null.
 *  - Cards are deep-copied on input and output, so a caller can never mutate
 *    state held by a store through a document it received.
 */
public final class Document {
    private final long version;
    private final List<JsonNode> cards;

    public Document(long version, List<JsonNode> cards) {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1");
        this.version = version;
        this.cards = List.copyOf(copyOf(Objects.requireNonNull(cards, "cards")));
    }

    /** The default document seeded into an empty store: {version:1, cards:[]}. */
    public static Document empty() {
        return new Document(1, List.of());
    }

    public long version() { return version; }

    /** Returns an independent deep copy of the cards. */
    public List<JsonNode> cards() { return copyOf(cards); }

    public int size() { return cards.size(); }

    private static List<JsonNode> copyOf(List<JsonNode> src) {
        List<JsonNode> out = new ArrayList<>(src.size());
        for (JsonNode card : src) {
            out.add(card == null ? NullNode.getInstance() : card.deepCopy());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return version == other.version && cards.equals(other.cards);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, cards);
    }

    @Override
    public String toString() {
        return "Document{version=" + version + ", cards=" + cards.size() + "}";
    }
}
