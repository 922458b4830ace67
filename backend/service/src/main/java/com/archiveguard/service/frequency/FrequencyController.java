package com.archiveguard.service.frequency;

import com.archiveguard.core.bus.EventBus;
import com.archiveguard.core.events.CollectionConfigChanged;
import com.archiveguard.core.events.CollectionStatusChanged;
import com.archiveguard.core.model.AuditEntry;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionStatus;
import com.archiveguard.core.model.ConfigPatch;
import com.archiveguard.core.model.IntervalSummary;
import com.archiveguard.core.model.OperationResult;
import com.archiveguard.core.model.RecommendedConfig;
import com.archiveguard.core.model.ValidationReport;
import com.archiveguard.core.util.JsonUtils;
import com.archiveguard.service.store.ConfigStore;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the collection configuration currently in effect.
 *
 * <p>Every mutation validates, persists a new version and swaps the cached copy under a single
 * lock, so concurrent writers are serialized and each one sees its predecessor's result as the
 * old value. Listeners are notified after the lock is released: a listener may call back into the
 * controller from any thread and observes the already-applied configuration.
 *
 * <p>No public operation throws; failures come back as {@link OperationResult#success()} false.
 */
public class FrequencyController {
    private static final Logger LOGGER = Logger.getLogger(FrequencyController.class.getName());
    private static final String AUDIT_MODULE = "collection_frequency";

    static final int MAX_HISTORY_LIMIT = 100;

    private final ConfigStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private CollectionConfig current;

    public FrequencyController(ConfigStore store, EventBus eventBus, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public EventBus.Subscription onConfigChange(Consumer<CollectionConfigChanged> listener) {
        return eventBus.subscribe(CollectionConfigChanged.class, listener);
    }

    public EventBus.Subscription onStatusChange(Consumer<CollectionStatusChanged> listener) {
        return eventBus.subscribe(CollectionStatusChanged.class, listener);
    }

    /**
     * The configuration in effect. Falls back to the built-in defaults, without caching them,
     * when the store cannot be read.
     */
    public CollectionConfig currentConfig() {
        lock.lock();
        try {
            return loadCurrent();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Loading collection config failed, serving built-in defaults", e);
            return CollectionConfig.defaults(CollectionConfig.SYSTEM_ACTOR, null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code patch} as a new version. A {@code null} patch changes nothing but still
     * records a version.
     */
    public OperationResult updateConfig(ConfigPatch patch, String actor) {
        return updateConfig(patch == null ? null : patch.toMap(), actor);
    }

    public OperationResult updateConfig(Map<String, ?> raw, String actor) {
        return update(raw == null ? Map.of() : raw, actor, "update");
    }

    public ValidationReport validateConfig(ConfigPatch patch) {
        return validateConfig(patch == null ? null : patch.toMap());
    }

    public ValidationReport validateConfig(Map<String, ?> raw) {
        try {
            return ConfigValidator.validate(raw == null ? Map.of() : raw);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Config validation failed unexpectedly", e);
            return ValidationReport.failed("Validation failed: " + e.getMessage());
        }
    }

    public OperationResult pauseCollection(String actor) {
        return togglePause(true, actor);
    }

    public OperationResult resumeCollection(String actor) {
        return togglePause(false, actor);
    }

    public OperationResult resetToDefault(String actor) {
        Optional<String> violation = ConfigValidator.actorViolation(actor);
        if (violation.isPresent()) {
            return OperationResult.failure(violation.get()).withConfig(currentConfig());
        }
        return commit(actor, "reset", "Configuration reset to defaults",
                old -> CollectionConfig.defaults(actor, nextTimestamp(old)));
    }

    /**
     * Most recent versions first; {@code limit} is clamped to 1..100.
     */
    public List<CollectionConfig> configHistory(int limit) {
        int clamped = Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
        try {
            return store.recentConfigs(clamped);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reading config history failed", e);
            return List.of();
        }
    }

    public PerformanceMetrics performanceMetrics() {
        Instant now = clock.instant();
        try {
            CollectionConfig config;
            lock.lock();
            try {
                config = loadCurrent();
            } finally {
                lock.unlock();
            }
            CollectionStatus latestStatus = store.latestStatus().orElse(null);
            return new PerformanceMetrics(
                    IntervalSummary.of(config),
                    config.performanceImpact(),
                    RecommendedConfig.BALANCED,
                    latestStatus,
                    now,
                    null
            );
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Building performance metrics failed", e);
            return PerformanceMetrics.failed(now, e.getMessage());
        }
    }

    public String exportConfig() {
        try {
            return JsonUtils.objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(currentConfig());
        } catch (JsonProcessingException e) {
            LOGGER.log(Level.WARNING, "Exporting collection config failed", e);
            return "{}";
        }
    }

    /**
     * Applies an exported configuration. Only the interval and pause fields are read; everything
     * is validated before anything is written.
     */
    public OperationResult importConfig(String json, String actor) {
        if (json == null || json.isBlank()) {
            return OperationResult.failure("Invalid config format: empty payload").withConfig(currentConfig());
        }
        Map<String, Object> raw;
        try {
            raw = JsonUtils.readObject(json);
        } catch (JsonProcessingException e) {
            LOGGER.warning("Rejected config import by " + actor + ": " + e.getOriginalMessage());
            return OperationResult.failure("Invalid config format: " + e.getOriginalMessage()).withConfig(currentConfig());
        } catch (IllegalArgumentException e) {
            return OperationResult.failure("Invalid config format: " + e.getMessage()).withConfig(currentConfig());
        }

        ValidationReport report = validateConfig(raw);
        if (!report.valid()) {
            return OperationResult.failure("Config validation failed: " + String.join(", ", report.errors()))
                    .withConfig(currentConfig());
        }
        return update(raw, actor, "import");
    }

    private OperationResult update(Map<String, ?> raw, String actor, String action) {
        Optional<String> violation = ConfigValidator.firstViolation(raw);
        if (violation.isEmpty()) {
            violation = ConfigValidator.actorViolation(actor);
        }
        if (violation.isPresent()) {
            LOGGER.warning("Rejected collection config " + action + " by " + actor + ": " + violation.get());
            return OperationResult.failure(violation.get()).withConfig(currentConfig());
        }
        ConfigPatch patch = ConfigValidator.toPatch(raw);
        return commit(actor, action, "Configuration updated",
                old -> old.apply(patch, actor, nextTimestamp(old)));
    }

    private OperationResult commit(String actor, String action, String successMessage, UnaryOperator<CollectionConfig> change) {
        CollectionConfigChanged event;
        lock.lock();
        try {
            CollectionConfig old = loadCurrent();
            CollectionConfig saved = persistVersion(change.apply(old));
            audit(describeChange(old, saved, action), saved.updatedBy(), "reset".equals(action));
            event = new CollectionConfigChanged(saved.updatedAt(), old, saved, saved.updatedBy(), action);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Collection config " + action + " failed", e);
            return OperationResult.failure("Configuration " + action + " failed: configuration store unavailable")
                    .withConfig(currentConfig());
        } finally {
            lock.unlock();
        }

        CollectionConfig applied = event.newConfig();
        LOGGER.info("Collection config " + action + " by " + applied.updatedBy()
                + ": sensor=" + applied.sensorInterval() + "s, rfid=" + applied.rfidInterval()
                + "s, paused=" + applied.paused());
        eventBus.publish(event);
        return OperationResult.success(successMessage).withConfig(applied);
    }

    private OperationResult togglePause(boolean pause, String actor) {
        String targetStatus = pause ? "paused" : "running";
        String action = pause ? "pause" : "resume";
        Optional<String> violation = ConfigValidator.actorViolation(actor);
        if (violation.isPresent()) {
            return OperationResult.failure(violation.get()).withStatus("error");
        }

        CollectionConfigChanged configEvent;
        lock.lock();
        try {
            CollectionConfig old = loadCurrent();
            if (old.paused() == pause) {
                return OperationResult.success(pause ? "Collection is already paused" : "Collection is already running")
                        .withStatus(targetStatus);
            }
            CollectionConfig saved = persistVersion(old.apply(new ConfigPatch(null, null, pause), actor, nextTimestamp(old)));
            recordStatusChange(!pause, saved.updatedAt());
            audit("Collection state changed to " + targetStatus, saved.updatedBy(), true);
            configEvent = new CollectionConfigChanged(saved.updatedAt(), old, saved, saved.updatedBy(), action);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Collection " + action + " failed", e);
            return OperationResult.failure("Failed to " + action + " collection: configuration store unavailable")
                    .withStatus("error");
        } finally {
            lock.unlock();
        }

        LOGGER.info("Collection " + targetStatus + " by " + configEvent.actor());
        eventBus.publish(configEvent);
        eventBus.publish(new CollectionStatusChanged(
                configEvent.timestamp(),
                pause ? CollectionStatusChanged.PAUSED : CollectionStatusChanged.RESUMED,
                configEvent.actor()
        ));
        return OperationResult.success(pause ? "Collection paused" : "Collection resumed").withStatus(targetStatus);
    }

    // Caller holds the lock.
    private CollectionConfig loadCurrent() {
        if (current == null) {
            current = store.latestConfig().orElseGet(() -> {
                LOGGER.info("No collection config stored, creating defaults");
                return store.insertConfig(CollectionConfig.defaults(CollectionConfig.SYSTEM_ACTOR, clock.instant()));
            });
            LOGGER.info("Loaded collection config: sensor=" + current.sensorInterval() + "s, rfid="
                    + current.rfidInterval() + "s, paused=" + current.paused());
        }
        return current;
    }

    // Caller holds the lock. The cache only moves once the store accepted the row.
    private CollectionConfig persistVersion(CollectionConfig candidate) {
        CollectionConfig saved = store.insertConfig(candidate);
        current = saved;
        return saved;
    }

    private Instant nextTimestamp(CollectionConfig previous) {
        Instant now = clock.instant();
        if (previous.updatedAt() != null && !now.isAfter(previous.updatedAt())) {
            return previous.updatedAt().plusMillis(1);
        }
        return now;
    }

    private void recordStatusChange(boolean running, Instant at) {
        try {
            store.insertStatus(CollectionStatus.transition(at, running, null));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Recording collection state change failed", e);
        }
    }

    private void audit(String message, String actor, boolean always) {
        if (message == null && !always) {
            return;
        }
        try {
            store.appendAudit(AuditEntry.info(clock.instant(), AUDIT_MODULE,
                    message == null ? "Collection config reset: defaults restored" : message, actor));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Writing audit entry failed", e);
        }
    }

    static String describeChange(CollectionConfig old, CollectionConfig updated, String action) {
        List<String> changes = new ArrayList<>();
        if (old.sensorInterval() != updated.sensorInterval()) {
            changes.add("sensor interval " + old.sensorInterval() + "s -> " + updated.sensorInterval() + "s");
        }
        if (old.rfidInterval() != updated.rfidInterval()) {
            changes.add("RFID interval " + old.rfidInterval() + "s -> " + updated.rfidInterval() + "s");
        }
        if (old.paused() != updated.paused()) {
            changes.add("collection " + (updated.paused() ? "paused" : "running"));
        }
        if (changes.isEmpty()) {
            return null;
        }
        return "Collection config " + action + ": " + String.join(", ", changes);
    }
}
