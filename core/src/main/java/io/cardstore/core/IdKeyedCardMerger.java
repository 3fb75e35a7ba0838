// file: src/main/java/io/cardstore/core/IdKeyedCardMerger.java
package io.cardstore.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default id-keyed merge.
 * <p>
 * Algorithm:
 *  - Seed an insertion-ordered map keyed by {@link CardKeys#keyOf} from 'current'.
 *  - For each incoming card, in order:
 *      - key already present: replace the entry with the shallow field union
 *        (existing fields, overridden field-by-field by the incoming card),
 *      - key new: append it.
 *  - Return the map values.
 * <p>
 * Notes:
 *  - Cards without an id, on either side, are dropped from the result.
 *  - The union is shallow. A nested object in the incoming card replaces the
 *    existing one wholesale.
 *  - Existing ids keep their relative order; new ids append in incoming order.
 */
public final class IdKeyedCardMerger implements CardMerger {

    @Override
    public List<JsonNode> merge(List<JsonNode> current, List<JsonNode> incoming) {
        Map<String, JsonNode> byKey = new LinkedHashMap<>();

        if (current != null) {
            for (JsonNode c : current) {
                Optional<String> key = CardKeys.keyOf(c);
                key.ifPresent(k -> byKey.put(k, c));
            }
        }

        if (incoming != null) {
            for (JsonNode n : incoming) {
                Optional<String> key = CardKeys.keyOf(n);
                if (key.isEmpty()) continue;

                JsonNode existing = byKey.get(key.get());
                byKey.put(key.get(), existing == null ? n.deepCopy() : fieldUnion(existing, n));
            }
        }

        List<JsonNode> out = new ArrayList<>(byKey.size());
        for (JsonNode card : byKey.values()) {
            out.add(card.deepCopy());
        }
        return out;
    }

    private static JsonNode fieldUnion(JsonNode existing, JsonNode incoming) {
        // Both sides are objects here: keyOf only accepts objects.
        ObjectNode merged = ((ObjectNode) existing).deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = incoming.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            merged.set(f.getKey(), f.getValue().deepCopy());
        }
        return merged;
    }
}
