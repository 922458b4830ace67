package com.archiveguard.service.store;

import com.archiveguard.core.model.AuditEntry;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionStatus;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlConfigStoreTest {
    private static final Instant AT = Instant.parse("2026-05-10T12:00:00Z");

    @Test
    void assignsIncreasingIdsAndReturnsNewestFirst() throws Exception {
        Path dir = Files.createTempDirectory("config-store-");
        JsonlConfigStore store = new JsonlConfigStore(dir);

        CollectionConfig first = store.insertConfig(CollectionConfig.defaults("system", AT));
        CollectionConfig second = store.insertConfig(new CollectionConfig(null, 60, 20, false, "operator",
                AT.plusSeconds(5), AT.plusSeconds(5)));

        assertEquals(1L, first.id());
        assertEquals(2L, second.id());
        assertEquals(second, store.latestConfig().orElseThrow());
        assertEquals(List.of(second, first), store.recentConfigs(10));
        assertEquals(List.of(second), store.recentConfigs(1));
        assertEquals(first, store.findConfig(1).orElseThrow());
    }

    @Test
    void sameTimestampFavorsHighestId() throws Exception {
        JsonlConfigStore store = new JsonlConfigStore(Files.createTempDirectory("config-store-"));

        store.insertConfig(CollectionConfig.defaults("system", AT));
        CollectionConfig later = store.insertConfig(new CollectionConfig(null, 45, 10, false, "operator", AT, AT));

        assertEquals(later, store.latestConfig().orElseThrow());
    }

    @Test
    void reloadsEverythingFromDisk() throws Exception {
        Path dir = Files.createTempDirectory("config-store-");
        JsonlConfigStore store = new JsonlConfigStore(dir);
        CollectionConfig saved = store.insertConfig(new CollectionConfig(null, 90, 15, true, "operator", AT, AT));
        store.insertStatus(new CollectionStatus(null, AT, true, AT, null, 12.5, 40.0, null));
        store.appendAudit(AuditEntry.info(AT, "collection_frequency", "Collection state changed to paused", "operator"));

        JsonlConfigStore reopened = new JsonlConfigStore(dir);

        assertEquals(saved, reopened.latestConfig().orElseThrow());
        assertEquals(12.5, reopened.latestStatus().orElseThrow().cpuUsage());
        assertEquals("operator", reopened.recentAudit(5).get(0).actor());
        assertEquals(2L, reopened.insertConfig(CollectionConfig.defaults("system", AT.plusSeconds(1))).id());
    }

    @Test
    void statusQueriesAndPruning() throws Exception {
        Path dir = Files.createTempDirectory("config-store-");
        JsonlConfigStore store = new JsonlConfigStore(dir);
        store.insertStatus(CollectionStatus.transition(AT.minus(Duration.ofDays(45)), true, null));
        store.insertStatus(CollectionStatus.transition(AT.minus(Duration.ofHours(2)), false, null));
        store.insertStatus(CollectionStatus.transition(AT, true, null));

        List<CollectionStatus> recent = store.statusSince(AT.minus(Duration.ofDays(1)), 10);
        int pruned = store.pruneStatusBefore(AT.minus(Duration.ofDays(30)));

        assertEquals(2, recent.size());
        assertEquals(AT, recent.get(0).timestamp());
        assertEquals(1, pruned);
        assertEquals(0, store.pruneStatusBefore(AT.minus(Duration.ofDays(30))));
        assertEquals(2, new JsonlConfigStore(dir).statusSince(Instant.EPOCH, 10).size());
    }

    @Test
    void corruptLineFailsWithFileAndLine() throws Exception {
        Path dir = Files.createTempDirectory("config-store-");
        Files.writeString(dir.resolve("collection_configs.jsonl"), "{\"id\":1,\"sensorInterval\":30,\"rfidInterval\":10}\nnot-json\n",
                StandardCharsets.UTF_8);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new JsonlConfigStore(dir));

        assertTrue(error.getMessage().contains("collection_configs.jsonl"));
        assertTrue(error.getMessage().contains("line 2"));
    }
}
