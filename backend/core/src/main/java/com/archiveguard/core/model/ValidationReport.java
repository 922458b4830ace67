package com.archiveguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record ValidationReport(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        @JsonInclude(JsonInclude.Include.ALWAYS) PerformanceImpact performanceImpact
) {
    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationReport failed(String error) {
        return new ValidationReport(false, List.of(error), List.of(), null);
    }
}
