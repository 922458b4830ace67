package com.archiveguard.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilsTest {
    @Test
    void readObjectKeepsRawTypesForValidation() throws Exception {
        Map<String, Object> parsed = JsonUtils.readObject("{\"sensorInterval\":\"30\",\"rfidInterval\":10,\"isPaused\":false}");

        assertEquals("30", parsed.get("sensorInterval"));
        assertEquals(10, parsed.get("rfidInterval"));
        assertEquals(Boolean.FALSE, parsed.get("isPaused"));
    }

    @Test
    void readObjectRejectsMalformedJson() {
        assertThrows(JsonProcessingException.class, () -> JsonUtils.readObject("{not json"));
    }

    @Test
    void readObjectRejectsNonObjects() {
        assertThrows(JsonProcessingException.class, () -> JsonUtils.readObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.readObject("null"));
    }
}
