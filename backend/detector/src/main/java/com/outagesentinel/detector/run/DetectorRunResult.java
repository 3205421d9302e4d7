package com.outagesentinel.detector.run;

import com.outagesentinel.core.model.NodeReport;
import com.outagesentinel.core.model.NodeStatus;
import com.outagesentinel.core.model.ProviderState;
import com.outagesentinel.detector.gate.ControlVerdict;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record DetectorRunResult(
        Instant timestamp,
        ControlVerdict control,
        List<NodeReport> reports,
        Map<String, ProviderState> groupSummary,
        Optional<NodeStatus> nodeStatus
) {
    public List<NodeReport> nonOkReports() {
        return reports.stream().filter(report -> report.confirmedState() != ProviderState.OK).toList();
    }
}
