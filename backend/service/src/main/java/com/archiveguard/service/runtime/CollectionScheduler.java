package com.archiveguard.service.runtime;

import com.archiveguard.collectors.api.Collector;
import com.archiveguard.collectors.api.CollectorContext;
import com.archiveguard.collectors.api.CollectorResult;
import com.archiveguard.collectors.api.JobType;
import com.archiveguard.core.bus.EventBus;
import com.archiveguard.core.events.AlertRaised;
import com.archiveguard.core.events.CollectionConfigChanged;
import com.archiveguard.core.events.CollectionStatusChanged;
import com.archiveguard.core.events.CollectorTickCompleted;
import com.archiveguard.core.events.CollectorTickStarted;
import com.archiveguard.core.model.CollectionConfig;
import com.archiveguard.core.model.CollectionError;
import com.archiveguard.core.model.CollectionStatus;
import com.archiveguard.core.model.ConfigPatch;
import com.archiveguard.core.model.OperationResult;
import com.archiveguard.core.model.ResourceUsage;
import com.archiveguard.service.frequency.FrequencyController;
import com.archiveguard.service.store.ConfigStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the sensor and RFID collectors at the intervals held by {@link FrequencyController} and
 * samples host resources while running.
 *
 * <p>The scheduler follows the controller: interval changes reschedule the affected job, pausing
 * stops collection and an explicit resume starts it again. Lifecycle transitions are serialized by
 * one lock; tick bookkeeping uses a separate monitor so ticks never wait on a start or stop.
 */
public class CollectionScheduler implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(CollectionScheduler.class.getName());
    private static final String SCHEDULER_ACTOR = "scheduler";
    private static final int POOL_SIZE = 3;
    private static final Set<String> PAUSE_ACTIONS = Set.of("pause", "resume");

    static final int MAX_HISTORY_HOURS = 168;
    static final int MAX_HISTORY_LIMIT = 1000;

    private final FrequencyController controller;
    private final CollectorContext context;
    private final Map<JobType, Collector> collectors;
    private final ConfigStore store;
    private final ResourceSampler resourceSampler;
    private final SchedulerSettings settings;
    private final Clock clock;
    private final Duration intervalUnit;
    private final ScheduledExecutorService executor;
    private final List<EventBus.Subscription> subscriptions = new ArrayList<>();

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile boolean running;
    private final Map<JobType, ScheduledFuture<?>> jobs = new EnumMap<>(JobType.class);
    private final Map<JobType, Integer> periods = new EnumMap<>(JobType.class);
    private Future<?> monitor;
    private CountDownLatch monitorStop;

    private final Object stateLock = new Object();
    private final Map<JobType, Instant> lastCollection = new EnumMap<>(JobType.class);
    private final Deque<CollectionError> errors = new ArrayDeque<>();

    public CollectionScheduler(
            FrequencyController controller,
            CollectorContext context,
            List<Collector> collectors,
            ConfigStore store,
            ResourceSampler resourceSampler,
            SchedulerSettings settings
    ) {
        this(controller, context, collectors, store, resourceSampler, settings, Duration.ofSeconds(1));
    }

    CollectionScheduler(
            FrequencyController controller,
            CollectorContext context,
            List<Collector> collectors,
            ConfigStore store,
            ResourceSampler resourceSampler,
            SchedulerSettings settings,
            Duration intervalUnit
    ) {
        this.controller = Objects.requireNonNull(controller, "controller is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.resourceSampler = Objects.requireNonNull(resourceSampler, "resourceSampler is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.intervalUnit = Objects.requireNonNull(intervalUnit, "intervalUnit is required");
        this.clock = context.clock();
        this.collectors = new EnumMap<>(JobType.class);
        for (Collector collector : collectors) {
            this.collectors.put(collector.jobType(), collector);
        }
        for (JobType type : JobType.values()) {
            if (!this.collectors.containsKey(type)) {
                throw new IllegalArgumentException("No collector registered for job type " + type.label());
            }
        }
        this.executor = Executors.newScheduledThreadPool(POOL_SIZE, daemonThreads());
        subscriptions.add(controller.onConfigChange(this::handleConfigChange));
        subscriptions.add(controller.onStatusChange(this::handleStatusChange));
    }

    public boolean isRunning() {
        return running;
    }

    public OperationResult startCollection() {
        lifecycleLock.lock();
        try {
            if (running) {
                return OperationResult.success("Collection is already running").withStatus("running");
            }
            CollectionConfig config = controller.currentConfig();
            if (config.paused()) {
                LOGGER.info("Collection start refused: collection is paused");
                return OperationResult.failure("Collection is paused; resume it before starting")
                        .withStatus("paused")
                        .withConfig(config);
            }
            schedule(JobType.SENSOR, config.sensorInterval());
            schedule(JobType.RFID, config.rfidInterval());
            startMonitor();
            running = true;
            recordTransition(true);
            LOGGER.info("Collection started: sensor=" + config.sensorInterval() + "s, rfid="
                    + config.rfidInterval() + "s");
            return OperationResult.success("Collection started").withStatus("running").withConfig(config);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Starting collection failed", e);
            cancelJobs();
            return OperationResult.failure("Failed to start collection: " + e.getMessage()).withStatus("error");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public OperationResult stopCollection() {
        lifecycleLock.lock();
        try {
            if (!running) {
                return OperationResult.success("Collection is already stopped").withStatus("stopped");
            }
            stopMonitor();
            cancelJobs();
            running = false;
            recordTransition(false);
            LOGGER.info("Collection stopped");
            return OperationResult.success("Collection stopped").withStatus("stopped");
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Stopping collection failed", e);
            return OperationResult.failure("Failed to stop collection: " + e.getMessage()).withStatus("error");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public OperationResult updateIntervals(Integer sensorInterval, Integer rfidInterval) {
        return updateIntervals(ConfigPatch.intervals(sensorInterval, rfidInterval).toMap());
    }

    /**
     * Applies new intervals through the controller and reschedules the jobs whose period changed.
     * Only the two interval keys of {@code raw} are read.
     */
    public OperationResult updateIntervals(Map<String, ?> raw) {
        if (!running) {
            return OperationResult.failure("Collection is not running").withStatus("stopped");
        }
        Map<String, Object> intervals = new LinkedHashMap<>();
        if (raw == null) {
            raw = Map.of();
        }
        if (raw.get(ConfigPatch.SENSOR_INTERVAL) != null) {
            intervals.put(ConfigPatch.SENSOR_INTERVAL, raw.get(ConfigPatch.SENSOR_INTERVAL));
        }
        if (raw.get(ConfigPatch.RFID_INTERVAL) != null) {
            intervals.put(ConfigPatch.RFID_INTERVAL, raw.get(ConfigPatch.RFID_INTERVAL));
        }
        if (intervals.isEmpty()) {
            return OperationResult.failure("At least one of sensorInterval or rfidInterval is required")
                    .withStatus("running");
        }

        OperationResult result = controller.updateConfig(intervals, SCHEDULER_ACTOR);
        if (!result.success()) {
            return result.withStatus("running");
        }
        rescheduleToCurrent();
        return OperationResult.success("Collection intervals updated")
                .withStatus(running ? "running" : "stopped")
                .withConfig(result.config());
    }

    public SchedulerStatus status() {
        Instant now = clock.instant();
        try {
            CollectionConfig config = controller.currentConfig();
            ResourceUsage usage = resourceSampler.sample();
            List<CollectionError> recentErrors;
            SchedulerStatus.LastCollection last;
            synchronized (stateLock) {
                recentErrors = recentErrors(SchedulerSettings.RECENT_ERROR_COUNT);
                last = new SchedulerStatus.LastCollection(
                        lastCollection.get(JobType.SENSOR), lastCollection.get(JobType.RFID));
            }
            return new SchedulerStatus(
                    running,
                    config.paused(),
                    new SchedulerStatus.Intervals(config.sensorInterval(), config.rfidInterval()),
                    last,
                    usage,
                    recentErrors,
                    statistics(),
                    now,
                    null
            );
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Building collection status failed", e);
            return SchedulerStatus.failed(now, e.getMessage());
        }
    }

    public CollectionStatistics statistics() {
        int sensorErrors;
        int rfidErrors;
        int totalErrors;
        synchronized (stateLock) {
            totalErrors = errors.size();
            sensorErrors = countErrors(JobType.SENSOR);
            rfidErrors = countErrors(JobType.RFID);
        }
        CollectionStatistics.ErrorCounts errorCounts =
                new CollectionStatistics.ErrorCounts(totalErrors, sensorErrors, rfidErrors);
        try {
            Instant midnight = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
            return new CollectionStatistics(
                    new CollectionStatistics.Today(
                            context.readingStore().countReadingsSince(midnight),
                            context.readingStore().countSightingsSince(midnight)),
                    errorCounts
            );
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Counting today's collections failed", e);
            return new CollectionStatistics(CollectionStatistics.EMPTY.today(), errorCounts);
        }
    }

    /**
     * Status rows from the last {@code hours} (1..168), at most {@code limit} (1..1000), newest first.
     */
    public List<CollectionStatus> statusHistory(int hours, int limit) {
        int clampedHours = Math.max(1, Math.min(MAX_HISTORY_HOURS, hours));
        int clampedLimit = Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
        try {
            return store.statusSince(clock.instant().minus(Duration.ofHours(clampedHours)), clampedLimit);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Reading status history failed", e);
            return List.of();
        }
    }

    public OperationResult forceCollectSensorData() {
        return force(JobType.SENSOR, "Sensor data collected", "Sensor data collection failed");
    }

    public OperationResult forceScanRfidDevices() {
        return force(JobType.RFID, "RFID scan completed", "RFID scan failed");
    }

    @Override
    public void close() {
        for (EventBus.Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        stopCollection();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Collection executor did not terminate in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Interval in seconds the job is currently scheduled with, or null when it is not scheduled.
    Integer scheduledInterval(JobType type) {
        lifecycleLock.lock();
        try {
            return periods.get(type);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private OperationResult force(JobType type, String successMessage, String failureMessage) {
        CollectorResult result = runTick(type);
        Instant now = clock.instant();
        if (result.success()) {
            return OperationResult.success(successMessage).withTimestamp(now).withDetails(result.stats());
        }
        return OperationResult.failure(failureMessage + ": " + result.message())
                .withTimestamp(now)
                .withDetails(result.stats());
    }

    CollectorResult runTick(JobType type) {
        Collector collector = collectors.get(type);
        context.eventBus().publish(new CollectorTickStarted(clock.instant(), type.label()));
        long startedNanos = System.nanoTime();
        CollectorResult result;
        try {
            result = collector.collect(context);
            if (result.success()) {
                markCollected(type, clock.instant());
            } else {
                recordError(type, result.message());
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Collection tick failed: " + type.label(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            recordError(type, message);
            result = CollectorResult.failure(message, Map.of("jobType", type.label()));
        }
        long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        context.eventBus().publish(new CollectorTickCompleted(clock.instant(), type.label(), result.success(), durationMillis));
        return result;
    }

    private void handleConfigChange(CollectionConfigChanged event) {
        if (event.pausedChanged()) {
            followPauseFlag(PAUSE_ACTIONS.contains(event.action()));
        }
        if (event.sensorIntervalChanged() || event.rfidIntervalChanged()) {
            rescheduleToCurrent();
        }
    }

    private void handleStatusChange(CollectionStatusChanged event) {
        if (event.isPaused() || event.isResumed()) {
            followPauseFlag(true);
        }
    }

    // Notifications are delivered outside the controller's lock and may arrive out of commit order,
    // so the lifecycle settles on the flag currently in effect rather than on the event payload.
    private void followPauseFlag(boolean startWhenUnpaused) {
        lifecycleLock.lock();
        try {
            boolean paused = controller.currentConfig().paused();
            if (paused && running) {
                stopCollection();
            } else if (!paused && !running && startWhenUnpaused) {
                startCollection();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    // Reads the controller rather than the event so late notifications settle on the latest version.
    private void rescheduleToCurrent() {
        lifecycleLock.lock();
        try {
            if (!running) {
                return;
            }
            CollectionConfig config = controller.currentConfig();
            rescheduleIfChanged(JobType.SENSOR, config.sensorInterval());
            rescheduleIfChanged(JobType.RFID, config.rfidInterval());
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Rescheduling collection jobs failed", e);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void rescheduleIfChanged(JobType type, int intervalSeconds) {
        Integer currentPeriod = periods.get(type);
        if (currentPeriod != null && currentPeriod == intervalSeconds) {
            return;
        }
        ScheduledFuture<?> previous = jobs.remove(type);
        if (previous != null) {
            previous.cancel(false);
        }
        schedule(type, intervalSeconds);
        LOGGER.info("Rescheduled " + type.label() + " collection: " + currentPeriod + "s -> " + intervalSeconds + "s");
    }

    // Caller holds the lifecycle lock.
    private void schedule(JobType type, int intervalSeconds) {
        long periodMillis = intervalUnit.toMillis() * intervalSeconds;
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> runTick(type),
                periodMillis,
                periodMillis,
                TimeUnit.MILLISECONDS
        );
        jobs.put(type, future);
        periods.put(type, intervalSeconds);
    }

    private void cancelJobs() {
        for (ScheduledFuture<?> job : jobs.values()) {
            job.cancel(false);
        }
        jobs.clear();
        periods.clear();
    }

    private void startMonitor() {
        CountDownLatch stopSignal = new CountDownLatch(1);
        long periodMillis = settings.statusSampleInterval().toMillis();
        monitorStop = stopSignal;
        monitor = executor.submit(() -> monitorLoop(stopSignal, periodMillis));
    }

    private void stopMonitor() {
        if (monitor == null) {
            return;
        }
        monitorStop.countDown();
        try {
            monitor.get(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warning("Resource monitor did not stop within " + settings.stopTimeout().toMillis()
                    + "ms, abandoning it");
            monitor.cancel(true);
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Resource monitor ended with an error", e.getCause());
        } catch (CancellationException e) {
            LOGGER.fine("Resource monitor was already cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            monitor = null;
            monitorStop = null;
        }
    }

    private void monitorLoop(CountDownLatch stopSignal, long periodMillis) {
        try {
            while (!stopSignal.await(periodMillis, TimeUnit.MILLISECONDS)) {
                sampleResources();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void sampleResources() {
        try {
            ResourceUsage usage = resourceSampler.sample();
            Instant now = clock.instant();
            Instant sensorLast;
            Instant rfidLast;
            String lastError;
            synchronized (stateLock) {
                sensorLast = lastCollection.get(JobType.SENSOR);
                rfidLast = lastCollection.get(JobType.RFID);
                lastError = errors.isEmpty() ? null : errors.peekLast().message();
            }
            store.insertStatus(new CollectionStatus(null, now, true, sensorLast, rfidLast,
                    usage.cpuUsage(), usage.memoryUsage(), lastError));
            Instant cutoff = now.minus(settings.statusRetention());
            int pruned = store.pruneStatusBefore(cutoff);
            if (pruned > 0) {
                LOGGER.fine("Pruned " + pruned + " expired status rows");
            }
            int prunedReadings = context.readingStore().pruneBefore(cutoff);
            if (prunedReadings > 0) {
                LOGGER.fine("Pruned " + prunedReadings + " expired readings and sightings");
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Recording resource usage failed", e);
        }
    }

    private void recordTransition(boolean nowRunning) {
        Instant sensorLast;
        Instant rfidLast;
        synchronized (stateLock) {
            sensorLast = lastCollection.get(JobType.SENSOR);
            rfidLast = lastCollection.get(JobType.RFID);
        }
        try {
            store.insertStatus(new CollectionStatus(null, clock.instant(), nowRunning, sensorLast, rfidLast,
                    null, null, null));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Recording collection status failed", e);
        }
    }

    private void markCollected(JobType type, Instant at) {
        synchronized (stateLock) {
            lastCollection.put(type, at);
            errors.removeIf(error -> error.type().equals(type.label()));
        }
    }

    private void recordError(JobType type, String message) {
        Instant now = clock.instant();
        synchronized (stateLock) {
            errors.addLast(new CollectionError(type.label(), message, now));
            while (errors.size() > settings.errorHistoryLimit()) {
                errors.removeFirst();
            }
        }
        context.eventBus().publish(new AlertRaised(
                now,
                "collection",
                "Collection failed: " + type.label() + " - " + message,
                Map.of("jobType", type.label())
        ));
    }

    // Caller holds the state lock.
    private List<CollectionError> recentErrors(int count) {
        List<CollectionError> all = new ArrayList<>(errors);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    // Caller holds the state lock.
    private int countErrors(JobType type) {
        int count = 0;
        for (CollectionError error : errors) {
            if (error.type().equals(type.label())) {
                count++;
            }
        }
        return count;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "collection-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
