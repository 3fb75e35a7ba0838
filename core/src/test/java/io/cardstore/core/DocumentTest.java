package io.cardstore.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void empty_document_is_version_one_with_no_cards() {
        Document d = Document.empty();
        assertEquals(1, d.version());
        assertNotNull(d.cards());
        assertTrue(d.cards().isEmpty());
    }

    @Test
    void mutating_returned_cards_does_not_touch_document() throws Exception {
        Document d = new Document(3, List.of(MAPPER.readTree("{\"id\":\"a\",\"name\":\"Alpha\"}")));

        List<JsonNode> view = d.cards();
        ((ObjectNode) view.get(0)).put("name", "changed");
        view.clear();

        assertEquals(1, d.size());
        assertEquals("Alpha", d.cards().get(0).get("name").asText());
    }

    @Test
    void mutating_input_list_after_construction_does_not_touch_document() throws Exception {
        List<JsonNode> input = new ArrayList<>();
        input.add(MAPPER.readTree("{\"id\":\"a\"}"));
        Document d = new Document(1, input);

        ((ObjectNode) input.get(0)).put("id", "b");
        input.add(MAPPER.readTree("{\"id\":\"c\"}"));

        assertEquals(1, d.size());
        assertEquals("a", d.cards().get(0).get("id").asText());
    }

    @Test
    void version_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new Document(0, List.of()));
    }

    @Test
    void equality_is_structural() throws Exception {
        var a = new Document(2, List.of(MAPPER.readTree("{\"id\":1}")));
        var b = new Document(2, List.of(MAPPER.readTree("{\"id\":1}")));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Document(3, List.of(MAPPER.readTree("{\"id\":1}"))));
    }
}
