package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PerformanceLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
