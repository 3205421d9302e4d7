package com.outagesentinel.detector.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DetectorConfig(
        String region,
        String nodeId,
        long timeoutMs,
        int consecutiveFailForMajor,
        int consecutiveOkForRecovery,
        List<String> controlProbes,
        Map<String, String> providers,
        boolean emitJson,
        String stateFile,
        String eventLog,
        ReportingConfig reporting
) {
    public static final long DEFAULT_TIMEOUT_MS = 7000;
    public static final int DEFAULT_FAIL_FOR_MAJOR = 3;
    public static final int DEFAULT_OK_FOR_RECOVERY = 5;
    private static final Duration DNS_TIMEOUT_CEILING = Duration.ofSeconds(5);

    public DetectorConfig {
        region = region == null || region.isBlank() ? "default" : region;
        nodeId = nodeId == null || nodeId.isBlank() ? region : nodeId;
        timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
        consecutiveFailForMajor = consecutiveFailForMajor > 0 ? consecutiveFailForMajor : DEFAULT_FAIL_FOR_MAJOR;
        consecutiveOkForRecovery = consecutiveOkForRecovery > 0 ? consecutiveOkForRecovery : DEFAULT_OK_FOR_RECOVERY;
        controlProbes = controlProbes == null ? List.of() : List.copyOf(controlProbes);
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        stateFile = stateFile == null || stateFile.isBlank() ? "state/providers.json" : stateFile;
        eventLog = eventLog == null || eventLog.isBlank() ? "logs/detector-events.jsonl" : eventLog;
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public Duration dnsTimeout() {
        Duration timeout = timeout();
        return timeout.compareTo(DNS_TIMEOUT_CEILING) < 0 ? timeout : DNS_TIMEOUT_CEILING;
    }
}
