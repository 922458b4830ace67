package com.archiveguard.service.config;

import com.archiveguard.collectors.config.DeviceConfig;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static ServiceConfig loadService(Path configDir) {
        return read(configDir.resolve("service.json"), new TypeReference<>() {
        });
    }

    public static DeviceConfig loadDevices(Path configDir) {
        return read(configDir.resolve("devices.json"), new TypeReference<>() {
        });
    }

    public static List<RfidTag> loadTags(Path configDir) {
        return read(configDir.resolve("tags.json"), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Config file is empty: " + path);
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
