// file: src/main/java/io/cardstore/core/CardMerger.java
package io.cardstore.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Pure function interface that folds an incoming batch of cards into the
 * currently stored collection.
 * <p>
 * This interface is deliberately ignorant of:
 *  - storage (file vs remote table),
 *  - versioning of the enclosing document, and
 *  - who is allowed to call it.
 */
public interface CardMerger {

    /**
     * Merge 'incoming' into 'current'.
     *
     * @param current  cards currently stored, in stored order
     * @param incoming cards supplied by the caller, in request order
     * @return a new list; neither input is mutated
     */
    List<JsonNode> merge(List<JsonNode> current, List<JsonNode> incoming);
}
