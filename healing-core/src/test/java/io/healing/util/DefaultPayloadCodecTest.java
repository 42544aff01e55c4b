package io.healing.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultPayloadCodecTest {

    private final PayloadCodec codec = PayloadCodec.getDefault();

    @Test
    void encodesRunPayload() {
        assertEquals("{\"runId\":\"run-42\"}", codec.encode(Map.of("runId", "run-42")));
    }

    @Test
    void emptyAndNullEncodeAsEmptyObject() {
        assertEquals("{}", codec.encode(Map.of()));
        assertEquals("{}", codec.encode(null));
    }

    @Test
    void escapesSpecialCharacters() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("runId", "a\"b\\c\nd\u0001");
        String json = codec.encode(data);

        assertEquals(data, codec.decode(json));
    }

    @Test
    void decodesWhitespaceAndDropsNulls() {
        Map<String, String> data = codec.decode(" { \"runId\" : \"r1\" , \"note\" : null } ");

        assertEquals(Map.of("runId", "r1"), data);
    }

    @Test
    void blankInputDecodesToEmptyMap() {
        assertTrue(codec.decode(null).isEmpty());
        assertTrue(codec.decode("  ").isEmpty());
        assertTrue(codec.decode("null").isEmpty());
        assertTrue(codec.decode("{}").isEmpty());
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> codec.decode("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"runId\":42}"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"runId\":\"x\""));
    }

    @Test
    void rejectsNullKeys() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(null, "x");
        assertThrows(IllegalArgumentException.class, () -> codec.encode(data));
    }
}
