package com.outagesentinel.service.runtime;

import com.outagesentinel.core.bus.EventBus;
import com.outagesentinel.core.model.ProviderDefinition;
import com.outagesentinel.detector.api.DetectorContext;
import com.outagesentinel.detector.api.Probe;
import com.outagesentinel.detector.config.DetectorConfig;
import com.outagesentinel.detector.config.ReportingConfig;
import com.outagesentinel.detector.probe.DnsProbe;
import com.outagesentinel.detector.probe.HttpProbe;
import com.outagesentinel.detector.run.CarrierOutageDetector;
import com.outagesentinel.detector.run.DetectorRunResult;
import com.outagesentinel.service.store.EventCodec;
import com.outagesentinel.service.store.JsonFileProviderStateRepository;
import com.outagesentinel.service.store.JsonlEventStore;
import com.outagesentinel.service.transport.HttpNodeStatusPublisher;

import java.net.InetAddress;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * One detector invocation with its sinks attached: the JSONL event log, optional JSON
 * lines on stdout, the state file, and the node status post to an aggregator.
 */
public class DetectorJob {
    private static final Logger LOGGER = Logger.getLogger(DetectorJob.class.getName());

    private final DetectorConfig config;
    private final List<ProviderDefinition> providers;
    private final Path workDir;
    private final HttpClient httpClient;
    private final Probe httpProbe;
    private final Probe dnsProbe;
    private final Clock clock;
    private final Consumer<String> jsonOut;

    public DetectorJob(
            DetectorConfig config,
            List<ProviderDefinition> providers,
            Path workDir,
            HttpClient httpClient,
            Clock clock,
            Consumer<String> jsonOut
    ) {
        this(config, providers, workDir, httpClient, new HttpProbe(httpClient), null, clock, jsonOut);
    }

    /**
     * A {@code null} DNS probe means the job resolves through the platform resolver on its
     * own pool, created for each run and shut down when the run ends.
     */
    DetectorJob(
            DetectorConfig config,
            List<ProviderDefinition> providers,
            Path workDir,
            HttpClient httpClient,
            Probe httpProbe,
            Probe dnsProbe,
            Clock clock,
            Consumer<String> jsonOut
    ) {
        this.config = config;
        this.providers = List.copyOf(providers);
        this.workDir = workDir;
        this.httpClient = httpClient;
        this.httpProbe = httpProbe;
        this.dnsProbe = dnsProbe;
        this.clock = clock;
        this.jsonOut = jsonOut;
    }

    public DetectorRunResult runOnce() {
        if (dnsProbe != null) {
            return runWith(dnsProbe);
        }
        ExecutorService dnsExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "dns-probe");
            thread.setDaemon(true);
            return thread;
        });
        try {
            return runWith(new DnsProbe(InetAddress::getAllByName, dnsExecutor));
        } finally {
            dnsExecutor.shutdownNow();
        }
    }

    private DetectorRunResult runWith(Probe dns) {
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(workDir.resolve(config.eventLog()));
        EventCodec.subscribeAll(eventBus, eventStore::append);
        if (config.emitJson()) {
            EventCodec.subscribeAll(eventBus, event -> jsonOut.accept(EventCodec.toJsonLine(event)));
        }

        DetectorContext context = new DetectorContext(
                httpProbe,
                dns,
                eventBus,
                new JsonFileProviderStateRepository(workDir.resolve(config.stateFile())),
                clock
        );
        DetectorRunResult result = new CarrierOutageDetector(config, providers).run(context);

        ReportingConfig reporting = config.reporting();
        if (reporting != null && reporting.aggregatorUrl() != null && !reporting.aggregatorUrl().isBlank()) {
            HttpNodeStatusPublisher publisher = new HttpNodeStatusPublisher(
                    httpClient,
                    reporting.aggregatorUrl(),
                    config.timeout(),
                    eventBus,
                    clock
            );
            result.nodeStatus().ifPresent(publisher::publish);
        } else {
            LOGGER.fine("No aggregator configured, node status kept local");
        }
        return result;
    }
}
