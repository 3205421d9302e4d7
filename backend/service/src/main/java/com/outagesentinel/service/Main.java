package com.outagesentinel.service;

import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.model.ProviderDefinition;
import com.outagesentinel.detector.config.DetectorConfig;
import com.outagesentinel.detector.run.DetectorRunResult;
import com.outagesentinel.service.config.ConfigLoader;
import com.outagesentinel.service.http.HttpClientFactory;
import com.outagesentinel.service.runtime.AggregatorService;
import com.outagesentinel.service.runtime.DetectorJob;
import com.outagesentinel.service.store.EventCodec;
import com.outagesentinel.service.store.JsonlEventStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point. {@code detect} (the default) runs the detector once and exits; an external
 * scheduler provides the cadence. {@code aggregate} runs the aggregator until stopped.
 */
public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        String mode = args.length > 0 ? args[0] : "detect";
        Path configDir = Path.of(System.getenv().getOrDefault("OUTAGE_SENTINEL_CONFIG", "config"));
        Path workDir = Path.of(System.getenv().getOrDefault("OUTAGE_SENTINEL_HOME", "."));

        try {
            switch (mode) {
                case "detect" -> detect(configDir, workDir);
                case "aggregate" -> aggregate(configDir, workDir);
                default -> {
                    LOGGER.severe(() -> "Unknown mode '" + mode + "', expected detect or aggregate");
                    System.exit(2);
                }
            }
        } catch (IllegalStateException fatal) {
            LOGGER.log(Level.SEVERE, "Startup failed: " + fatal.getMessage(), fatal);
            System.exit(1);
        }
    }

    private static void detect(Path configDir, Path workDir) {
        DetectorConfig config = ConfigLoader.loadDetector(configDir);
        List<ProviderDefinition> providers = ConfigLoader.loadProviders(configDir, config);

        DetectorJob job = new DetectorJob(
                config,
                providers,
                workDir,
                HttpClientFactory.create(Duration.ofMillis(config.timeoutMs())),
                Clock.systemUTC(),
                System.out::println
        );
        DetectorRunResult result = job.runOnce();
        LOGGER.info(() -> "Detector run finished: " + result.reports().size() + " providers, "
                + result.nonOkReports().size() + " not OK");
    }

    private static void aggregate(Path configDir, Path workDir) throws InterruptedException {
        AggregatorConfig config = ConfigLoader.loadAggregator(configDir);

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(workDir.resolve(config.eventLog()));
        EventCodec.subscribeAll(eventBus, eventStore::append);

        AggregatorService service = new AggregatorService(config, config.port(), eventBus, eventStore, Clock.systemUTC());
        service.start();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.shutdown();
            stopped.countDown();
        }, "aggregator-shutdown"));
        stopped.await();
    }
}
