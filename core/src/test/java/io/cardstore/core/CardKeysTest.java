package io.cardstore.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CardKeysTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Optional<String> key(String json) throws Exception {
        return CardKeys.keyOf(MAPPER.readTree(json));
    }

    @Test
    void text_and_number_ids_are_stringified() throws Exception {
        assertEquals(Optional.of("abc"), key("{\"id\":\"abc\"}"));
        assertEquals(Optional.of("7"), key("{\"id\":7}"));
        assertEquals(Optional.of("7"), key("{\"id\":7.0}"));
        assertEquals(Optional.of("70"), key("{\"id\":70}"));
        assertEquals(Optional.of("1.5"), key("{\"id\":1.50}"));
        assertEquals(Optional.of("0"), key("{\"id\":0}"));
        assertEquals(Optional.of("true"), key("{\"id\":true}"));
    }

    @Test
    void object_and_array_ids_render_as_compact_json() throws Exception {
        assertEquals(Optional.of("{\"k\":1}"), key("{\"id\":{ \"k\" : 1 }}"));
        assertEquals(Optional.of("[1,2]"), key("{\"id\":[1, 2]}"));
        assertNotEquals(key("{\"id\":{\"k\":1}}"), key("{\"id\":{\"k\":2}}"));
    }

    @Test
    void empty_string_is_still_an_id() throws Exception {
        assertEquals(Optional.of(""), key("{\"id\":\"\"}"));
    }

    @Test
    void missing_or_null_id_and_non_objects_are_anonymous() throws Exception {
        assertTrue(key("{\"name\":\"x\"}").isEmpty());
        assertTrue(key("{\"id\":null}").isEmpty());
        assertTrue(key("[1,2]").isEmpty());
        assertTrue(key("\"id\"").isEmpty());
        assertTrue(CardKeys.keyOf(null).isEmpty());
    }
}
