package com.archiveguard.core.model;

import java.time.Instant;

public record AuditEntry(Instant timestamp, String level, String module, String message, String actor) {
    public static AuditEntry info(Instant timestamp, String module, String message, String actor) {
        return new AuditEntry(timestamp, "INFO", module, message, actor);
    }
}
