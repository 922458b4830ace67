package com.archiveguard.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void portComesFromEnvironmentWhenValid() {
        List<String> warnings = new ArrayList<>();

        assertEquals(9191, Main.resolvePort(Map.of("COLLECTION_PORT", "9191"), 8080, warnings::add));
        assertEquals(8080, Main.resolvePort(Map.of(), 8080, warnings::add));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void invalidPortFallsBackWithWarning() {
        List<String> warnings = new ArrayList<>();

        assertEquals(8080, Main.resolvePort(Map.of("COLLECTION_PORT", "eighty"), 8080, warnings::add));
        assertEquals(8080, Main.resolvePort(Map.of("COLLECTION_PORT", "70000"), 8080, warnings::add));
        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).contains("COLLECTION_PORT=eighty"));
    }
}
