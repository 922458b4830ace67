package com.archiveguard.collectors.device;

public record TagDetection(String tagId, String deviceId, String location) {
}
