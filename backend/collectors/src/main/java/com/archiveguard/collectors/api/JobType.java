package com.archiveguard.collectors.api;

public enum JobType {
    SENSOR("sensor"),
    RFID("rfid");

    private final String label;

    JobType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
