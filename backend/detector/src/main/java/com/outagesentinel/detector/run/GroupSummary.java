package com.outagesentinel.detector.run;

import com.outagesentinel.core.model.NodeReport;
import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.core.model.ProviderType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Worst confirmed state per provider type. RECOVERED counts as OK here.
 */
public final class GroupSummary {
    private GroupSummary() {
    }

    public static Map<String, ProviderState> of(List<NodeReport> reports) {
        Map<String, ProviderState> summary = new LinkedHashMap<>();
        for (ProviderType type : ProviderType.values()) {
            summary.put(key(type), worst(reports.stream().filter(report -> report.providerType() == type).toList()));
        }
        return Collections.unmodifiableMap(summary);
    }

    public static ProviderState worst(List<NodeReport> reports) {
        boolean degraded = false;
        for (NodeReport report : reports) {
            if (report.confirmedState() == ProviderState.MAJOR_OUTAGE) {
                return ProviderState.MAJOR_OUTAGE;
            }
            degraded |= report.confirmedState() == ProviderState.DEGRADED;
        }
        return degraded ? ProviderState.DEGRADED : ProviderState.OK;
    }

    public static String key(ProviderType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
