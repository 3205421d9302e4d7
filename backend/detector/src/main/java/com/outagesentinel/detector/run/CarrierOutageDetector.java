package com.outagesentinel.detector.run;

import com.outagesentinel.core.events.DetectorHeartbeat;
import com.outagesentinel.core.events.DetectorRunCompleted;
import com.outagesentinel.core.events.ProviderOutageReported;
import com.outagesentinel.core.model.NodeReport;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.PersistedProviderState;
import com.outagesentinel.core.model.Presence;
import com.outagesentinel.core.model.ProviderDefinition;
import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.core.model.ProviderType;
import com.outagesentinel.core.model.Signal;
import com.outagesentinel.detector.api.DetectorContext;
import com.outagesentinel.detector.config.DetectorConfig;
import com.outagesentinel.detector.config.ReportingConfig;
import com.outagesentinel.detector.evaluate.Evaluation;
import com.outagesentinel.detector.evaluate.ProviderEvaluator;
import com.outagesentinel.detector.gate.ControlGate;
import com.outagesentinel.detector.gate.ControlVerdict;
import com.outagesentinel.detector.state.HysteresisStateMachine;
import com.outagesentinel.detector.state.Transition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * One detector run: control probes, provider probes, evaluation, hysteresis, emission.
 * Probes run sequentially; a failed probe is a failed signal and never aborts the run.
 * The run keeps no state of its own between invocations beyond what the repository holds.
 */
public class CarrierOutageDetector {
    private static final Logger LOGGER = Logger.getLogger(CarrierOutageDetector.class.getName());

    private final DetectorConfig config;
    private final List<ProviderDefinition> providers;
    private final HysteresisStateMachine hysteresis;

    public CarrierOutageDetector(DetectorConfig config, List<ProviderDefinition> providers) {
        this.config = config;
        this.providers = List.copyOf(providers);
        this.hysteresis = new HysteresisStateMachine(config.consecutiveFailForMajor(), config.consecutiveOkForRecovery());
    }

    public DetectorRunResult run(DetectorContext ctx) {
        Instant now = ctx.clock().instant();

        List<Signal> controlSignals = new ArrayList<>();
        for (String url : config.controlProbes()) {
            controlSignals.add(ctx.httpProbe().check("control:" + url, url, config.timeout()));
        }
        ControlVerdict control = ControlGate.evaluate(controlSignals);

        List<NodeReport> reports = new ArrayList<>();
        for (ProviderDefinition provider : providers) {
            reports.add(evaluateProvider(provider, control, ctx, now));
        }

        Map<String, ProviderState> groupSummary = GroupSummary.of(reports);
        logSummary(now, control, reports, groupSummary);

        DetectorRunResult result = new DetectorRunResult(now, control, List.copyOf(reports), groupSummary, nodeStatus(control, now));
        emit(result, controlSignals, ctx);

        ctx.eventBus().publish(new DetectorRunCompleted(
                ctx.clock().instant(),
                config.region(),
                reports.size(),
                result.nonOkReports().size(),
                control.ok(),
                Duration.between(now, ctx.clock().instant()).toMillis()
        ));
        return result;
    }

    private NodeReport evaluateProvider(ProviderDefinition provider, ControlVerdict control, DetectorContext ctx, Instant now) {
        List<Signal> signals = new ArrayList<>();
        for (String host : provider.dnsHosts()) {
            signals.add(ctx.dnsProbe().check("dns:" + host, host, config.dnsTimeout()));
        }
        for (String url : provider.probeUrls()) {
            signals.add(ctx.httpProbe().check("probe:" + url, url, config.timeout()));
        }

        Evaluation evaluation = ProviderEvaluator.evaluate(signals, control.ok());
        PersistedProviderState previous = ctx.stateRepository().get(provider.name())
                .orElseGet(PersistedProviderState::fresh);
        Transition transition = hysteresis.apply(previous, evaluation.rawState(), now);
        ctx.stateRepository().put(provider.name(), transition.state());

        if (transition.confirmedState() != previous.state()) {
            LOGGER.info(() -> "Provider " + provider.name() + " moved " + previous.state()
                    + " -> " + transition.confirmedState() + " (raw " + evaluation.rawState()
                    + ", " + evaluation.failed() + "/" + evaluation.total() + " signals failed)");
        }

        return new NodeReport(
                provider.name(),
                provider.type(),
                evaluation.rawState(),
                transition.confirmedState(),
                evaluation.confidence(),
                signals,
                transition.firstSeen(),
                now,
                control.ok()
        );
    }

    private void emit(DetectorRunResult result, List<Signal> controlSignals, DetectorContext ctx) {
        List<NodeReport> nonOk = result.nonOkReports();
        if (nonOk.isEmpty()) {
            ctx.eventBus().publish(new DetectorHeartbeat(
                    result.timestamp(),
                    config.region(),
                    result.control().ok(),
                    result.control().passed(),
                    result.control().total(),
                    result.groupSummary()
            ));
            return;
        }
        for (NodeReport report : nonOk) {
            List<Signal> signals = new ArrayList<>(controlSignals);
            signals.addAll(report.signals());
            ctx.eventBus().publish(new ProviderOutageReported(
                    result.timestamp(),
                    config.region(),
                    report.provider(),
                    report.providerType(),
                    report.confirmedState(),
                    report.rawState(),
                    report.confidence(),
                    List.copyOf(signals),
                    report.firstSeen(),
                    report.lastSeen(),
                    result.groupSummary()
            ));
        }
    }

    private Optional<NodeStatus> nodeStatus(ControlVerdict control, Instant now) {
        ReportingConfig reporting = config.reporting();
        if (reporting == null) {
            return Optional.empty();
        }
        return Optional.of(new NodeStatus(
                config.nodeId(),
                reporting.providerHint(),
                reporting.state(),
                config.region(),
                reporting.regionWeight(),
                control.ok(),
                Presence.ONLINE,
                now
        ));
    }

    private void logSummary(Instant now, ControlVerdict control, List<NodeReport> reports, Map<String, ProviderState> groupSummary) {
        StringBuilder summary = new StringBuilder()
                .append("region=").append(config.region()).append(" ts=").append(now).append('\n')
                .append("CONTROL: ").append(control.ok() ? "OK" : "FAIL")
                .append(" (").append(control.passed()).append('/').append(control.total()).append(')');
        for (ProviderType type : ProviderType.values()) {
            List<NodeReport> group = reports.stream().filter(report -> report.providerType() == type).toList();
            summary.append('\n').append(type.name().toUpperCase(Locale.ROOT)).append(": ");
            if (group.isEmpty()) {
                summary.append("(no providers)");
                continue;
            }
            summary.append(groupSummary.get(GroupSummary.key(type)))
                    .append(" (")
                    .append(group.stream()
                            .map(report -> report.provider() + "=" + report.confirmedState())
                            .collect(Collectors.joining(", ")))
                    .append(')');
        }
        LOGGER.info(summary::toString);
    }
}
