package com.archiveguard.core.model;

import java.time.Instant;

public record CollectionError(String type, String message, Instant timestamp) {
}
