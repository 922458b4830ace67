package com.archiveguard.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A partial configuration change; {@code null} fields are left untouched.
 */
public record ConfigPatch(Integer sensorInterval, Integer rfidInterval, Boolean paused) {
    public static final String SENSOR_INTERVAL = "sensorInterval";
    public static final String RFID_INTERVAL = "rfidInterval";
    public static final String IS_PAUSED = "isPaused";

    public static ConfigPatch intervals(Integer sensorInterval, Integer rfidInterval) {
        return new ConfigPatch(sensorInterval, rfidInterval, null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        if (sensorInterval != null) {
            raw.put(SENSOR_INTERVAL, sensorInterval);
        }
        if (rfidInterval != null) {
            raw.put(RFID_INTERVAL, rfidInterval);
        }
        if (paused != null) {
            raw.put(IS_PAUSED, paused);
        }
        return raw;
    }
}
