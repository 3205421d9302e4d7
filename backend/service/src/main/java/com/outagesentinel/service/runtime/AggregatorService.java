package com.outagesentinel.service.runtime;

import com.outagesentinel.aggregator.config.AggregatorConfig;
import com.outagesentinel.aggregator.engine.OutageAggregator;
import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.events.AlertRaised;
import com.outagesentinel.service.api.ApiServer;
import com.outagesentinel.service.store.EventStore;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-lived aggregator. Inbound HTTP messages and the periodic re-evaluation share one
 * thread, so the aggregator state is never touched concurrently.
 */
public class AggregatorService {
    private static final Logger LOGGER = Logger.getLogger(AggregatorService.class.getName());

    private final AggregatorConfig config;
    private final EventBus eventBus;
    private final Clock clock;
    private final OutageAggregator aggregator;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "outage-aggregator");
        thread.setDaemon(true);
        return thread;
    });
    private final ApiServer apiServer;

    public AggregatorService(AggregatorConfig config, int port, EventBus eventBus, EventStore eventStore, Clock clock) {
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
        this.aggregator = new OutageAggregator(config, eventBus);
        this.apiServer = new ApiServer(port, aggregator, eventStore, clock, executor);
    }

    public void start() {
        apiServer.start();
        executor.scheduleAtFixedRate(this::reevaluate, config.reevaluateMs(), config.reevaluateMs(), TimeUnit.MILLISECONDS);
        LOGGER.info(() -> "Aggregator listening on port " + apiServer.actualPort()
                + ", window " + config.window() + ", debounce " + config.debounce());
    }

    public void shutdown() {
        apiServer.stop();
        executor.shutdown();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int actualPort() {
        return apiServer.actualPort();
    }

    void reevaluate() {
        try {
            aggregator.evaluate(clock.instant());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Re-evaluation failed", e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "aggregator",
                    "Re-evaluation failed: " + e.getMessage(),
                    Map.of("error", e.getClass().getSimpleName())
            ));
        }
    }
}
