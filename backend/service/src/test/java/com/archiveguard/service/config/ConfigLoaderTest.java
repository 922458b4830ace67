package com.archiveguard.service.config;

import com.archiveguard.collectors.config.DeviceConfig;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.service.runtime.SchedulerSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsAllServiceConfigs() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("service.json"), """
                {"port":9090,"dataDir":"state","statusSampleSeconds":15,"stopTimeoutSeconds":2,
                 "statusRetentionDays":7,"errorHistoryLimit":20}
                """);
        Files.writeString(dir.resolve("devices.json"), """
                {
                  "sensors":[{"id":"S1","location":"Vault","baseTemperature":20.0,"baseHumidity":45.0,"baseLight":150.0}],
                  "readers":[{"id":"1","name":"R1","location":"Door","status":"offline"}],
                  "detectionProbability":0.5
                }
                """);
        Files.writeString(dir.resolve("tags.json"), """
                [{"tagId":"RFID_001","tagType":"archive","archiveId":"1","lastSeenLocation":"Vault"}]
                """);

        ServiceConfig service = ConfigLoader.loadService(dir);
        DeviceConfig devices = ConfigLoader.loadDevices(dir);
        List<RfidTag> tags = ConfigLoader.loadTags(dir);

        assertEquals(9090, service.port());
        assertEquals("state", service.dataDir());
        SchedulerSettings settings = service.schedulerSettings();
        assertEquals(Duration.ofSeconds(15), settings.statusSampleInterval());
        assertEquals(Duration.ofSeconds(2), settings.stopTimeout());
        assertEquals(Duration.ofDays(7), settings.statusRetention());
        assertEquals(20, settings.errorHistoryLimit());
        assertEquals("S1", devices.sensors().get(0).id());
        assertFalse(devices.readers().get(0).isOnline());
        assertEquals(0.5, devices.detectionProbability());
        assertEquals(1, tags.size());
        assertTrue(tags.get(0).isActive());
    }

    @Test
    void missingServiceFieldsFallBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("service.json"), "{}");

        ServiceConfig service = ConfigLoader.loadService(dir);

        assertEquals(ServiceConfig.defaults(), service);
        assertEquals(8080, service.port());
        assertEquals(Duration.ofSeconds(30), service.schedulerSettings().statusSampleInterval());
        assertEquals(50, service.schedulerSettings().errorHistoryLimit());
    }

    @Test
    void missingOrInvalidFilesNameThePath() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("devices.json"), "{\"detectionProbability\":2.0}");

        IllegalStateException missing = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadService(dir));
        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadDevices(dir));

        assertTrue(missing.getMessage().contains("service.json"));
        assertTrue(invalid.getMessage().contains("devices.json"));
    }

    @Test
    void repositorySampleConfigsLoad() {
        Path dir = Path.of("../../config");
        if (!Files.isDirectory(dir)) {
            return;
        }

        assertEquals(3, ConfigLoader.loadDevices(dir).sensors().size());
        assertFalse(ConfigLoader.loadTags(dir).isEmpty());
        assertEquals(8080, ConfigLoader.loadService(dir).port());
    }
}
