// file: src/main/java/io/cardstore/storage/DocumentCodec.java
package io.cardstore.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cardstore.core.Document;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the persisted document.
 * <p>
 * Format (files and the remote "payload" column alike):
 *   {
 *     "version": 3,
 *     "cards": [ {...}, {...} ]
 *   }
 * <p>
 * Decoding is lenient about the fields:
 *  - version missing, null, zero, negative or non-numeric -> 1
 *    (numeric strings such as "4" are accepted),
 *  - cards missing or not an array -> [].
 * A payload that is not a JSON object at all is rejected.
 */
public final class DocumentCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private DocumentCodec() {
        // utility
    }

    /** Pretty-printed UTF-8 JSON bytes. */
    public static byte[] encode(Document doc) throws IOException {
        return MAPPER.writeValueAsBytes(toJson(doc));
    }

    public static Document decode(byte[] bytes) throws IOException {
        return fromJson(MAPPER.readTree(bytes));
    }

    public static ObjectNode toJson(Document doc) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", doc.version());
        ArrayNode cards = root.putArray("cards");
        cards.addAll(doc.cards());
        return root;
    }

    public static Document fromJson(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("document payload must be a JSON object");
        }
        long version = versionOf(root.get("version"));

        JsonNode cardsNode = root.get("cards");
        List<JsonNode> cards = new ArrayList<>();
        if (cardsNode != null && cardsNode.isArray()) {
            cardsNode.forEach(cards::add);
        }
        return new Document(version, cards);
    }

    private static long versionOf(JsonNode v) {
        if (v == null || v.isNull()) return 1;
        long parsed;
        if (v.isNumber()) {
            parsed = v.asLong();
        } else if (v.isTextual()) {
            try {
                parsed = Long.parseLong(v.textValue().trim());
            } catch (NumberFormatException e) {
                return 1;
            }
        } else {
            return 1;
        }
        return parsed >= 1 ? parsed : 1;
    }
}
