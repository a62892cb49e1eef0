package io.taskqueue.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void nestedValuesSurviveEncoding() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", "send_email");
        payload.put("attempt", 2);
        payload.put("recipients", List.of("a@example.com", "b@example.com"));
        payload.put("meta", Map.of("priority", "high"));
        payload.put("note", null);

        Map<String, Object> parsed = codec.parseObject(codec.toJson(payload));

        assertEquals(payload, parsed);
        assertTrue(parsed.containsKey("note"));
        assertNull(parsed.get("note"));
    }

    @Test
    void preservesFieldOrder() {
        Map<String, Object> parsed = codec.parseObject("{\"z\":1,\"a\":2,\"m\":3}");

        assertEquals(List.of("z", "a", "m"), List.copyOf(parsed.keySet()));
    }

    @Test
    void blankInputIsEmptyObject() {
        assertTrue(codec.parseObject(null).isEmpty());
        assertTrue(codec.parseObject("  ").isEmpty());
    }

    @Test
    void nonObjectInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{broken"));
    }
}
