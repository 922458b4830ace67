package com.archiveguard.service;

import com.archiveguard.collectors.api.CollectorContext;
import com.archiveguard.collectors.config.DeviceConfig;
import com.archiveguard.collectors.device.SimulatedDeviceSampler;
import com.archiveguard.collectors.rfid.RfidCollector;
import com.archiveguard.collectors.sensor.SensorCollector;
import com.archiveguard.core.bus.EventBus;
import com.archiveguard.core.events.AlertRaised;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.service.api.ApiServer;
import com.archiveguard.service.config.ConfigLoader;
import com.archiveguard.service.config.ServiceConfig;
import com.archiveguard.service.frequency.FrequencyController;
import com.archiveguard.service.runtime.CollectionScheduler;
import com.archiveguard.service.runtime.JvmResourceSampler;
import com.archiveguard.service.store.JsonFileReadingStore;
import com.archiveguard.service.store.JsonlConfigStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");

        ServiceConfig serviceConfig = ConfigLoader.loadService(configDir);
        serviceConfig = serviceConfig.withPort(resolvePort(System.getenv(), serviceConfig.port(), LOGGER::warning));
        DeviceConfig deviceConfig = ConfigLoader.loadDevices(configDir);
        List<RfidTag> seedTags = ConfigLoader.loadTags(configDir);
        Path dataDir = Path.of(serviceConfig.dataDir());
        Clock clock = Clock.systemDefaultZone();

        EventBus eventBus = new EventBus();
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning("Alert [" + alert.category() + "]: " + alert.message()));

        JsonlConfigStore configStore = new JsonlConfigStore(dataDir);
        JsonFileReadingStore readingStore = new JsonFileReadingStore(dataDir, seedTags);
        SimulatedDeviceSampler sampler = new SimulatedDeviceSampler(
                deviceConfig,
                () -> readingStore.activeTags().stream().map(RfidTag::tagId).toList()
        );
        CollectorContext context = new CollectorContext(eventBus, readingStore, sampler, clock);

        FrequencyController controller = new FrequencyController(configStore, eventBus, clock);
        CollectionScheduler scheduler = new CollectionScheduler(
                controller,
                context,
                List.of(new SensorCollector(), new RfidCollector()),
                configStore,
                new JvmResourceSampler(),
                serviceConfig.schedulerSettings()
        );
        ApiServer apiServer = new ApiServer(serviceConfig.port(), controller, scheduler);

        if (controller.currentConfig().paused()) {
            LOGGER.info("Collection is paused; the scheduler stays stopped until collection is resumed");
        } else {
            scheduler.startCollection();
        }
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.close();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static int resolvePort(Map<String, String> env, int fallback, Consumer<String> warn) {
        String raw = env.get("COLLECTION_PORT");
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port >= 0 && port <= 65535) {
                return port;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        warn.accept("Invalid COLLECTION_PORT=" + raw + ", using " + fallback);
        return fallback;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not load logging.properties: " + e.getMessage());
        }
    }
}
