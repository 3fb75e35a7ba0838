package io.cardstore.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardstore.core.Document;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lenient decoding of stored payloads. Encoding is the plain {version, cards} shape.
 */
class DocumentCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Document decode(String json) throws IOException {
        return DocumentCodec.decode(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void encodes_version_and_cards_only() throws Exception {
        var doc = new Document(3, List.of(MAPPER.readTree("{\"id\":\"a\"}")));

        var root = MAPPER.readTree(DocumentCodec.encode(doc));

        assertEquals(2, root.size());
        assertEquals(3, root.get("version").asLong());
        assertEquals("a", root.get("cards").get(0).get("id").asText());
    }

    @Test
    void bad_or_missing_version_decodes_as_one() throws Exception {
        assertEquals(1, decode("{\"cards\":[]}").version());
        assertEquals(1, decode("{\"version\":null,\"cards\":[]}").version());
        assertEquals(1, decode("{\"version\":0,\"cards\":[]}").version());
        assertEquals(1, decode("{\"version\":-4,\"cards\":[]}").version());
        assertEquals(1, decode("{\"version\":\"abc\",\"cards\":[]}").version());
        assertEquals(1, decode("{\"version\":true,\"cards\":[]}").version());
    }

    @Test
    void numeric_string_version_is_accepted() throws Exception {
        assertEquals(12, decode("{\"version\":\"12\",\"cards\":[]}").version());
    }

    @Test
    void missing_or_non_array_cards_decode_as_empty() throws Exception {
        assertTrue(decode("{\"version\":2}").cards().isEmpty());
        assertTrue(decode("{\"version\":2,\"cards\":{\"id\":\"a\"}}").cards().isEmpty());
        assertTrue(decode("{\"version\":2,\"cards\":null}").cards().isEmpty());
    }

    @Test
    void non_object_payload_is_rejected() {
        assertThrows(IOException.class, () -> decode("[]"));
        assertThrows(IOException.class, () -> decode("42"));
    }

    @Test
    void cards_are_kept_verbatim_including_anonymous_and_scalar_entries() throws Exception {
        Document d = decode("{\"version\":2,\"cards\":[{\"name\":\"anon\"},7,null,{\"id\":\"a\"}]}");

        assertEquals(4, d.size());
        assertTrue(d.cards().get(2).isNull());
    }
}
