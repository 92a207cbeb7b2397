package com.evpn.auditor.reports;

import com.evpn.auditor.models.DeviceResult;
import com.evpn.auditor.models.FleetReport;
import com.evpn.auditor.models.RouteStatusCounts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Чистая свёртка набора результатов в {@link FleetReport}.
 * Результат не зависит от порядка входа: устройства сортируются по метке.
 */
public class ReportAggregator {

    static final Comparator<DeviceResult> BY_LABEL = Comparator
        .comparing(DeviceResult::label)
        .thenComparing(DeviceResult::isConnected)
        .thenComparing(result -> result.getStatusCounts().toString())
        .thenComparing(DeviceResult::isRestartAttempted)
        .thenComparing(DeviceResult::isRestartSucceeded);

    public FleetReport aggregate(Collection<DeviceResult> results, boolean fixMode) {
        List<DeviceResult> devices = new ArrayList<>();
        if (results != null) {
            results.stream().filter(Objects::nonNull).forEach(devices::add);
        }
        devices.sort(BY_LABEL);

        FleetReport.FleetReportBuilder report = FleetReport.builder()
            .fixMode(fixMode)
            .devices(devices);

        RouteStatusCounts totals = RouteStatusCounts.empty();
        for (DeviceResult device : devices) {
            // неподключённые устройства несут нулевые счётчики
            totals = totals.plus(device.getStatusCounts());
            if (!device.isConnected()) {
                report.connectionFailure(device);
            }
            if (!device.needsAttention()) {
                continue;
            }
            report.rejectedDevice(device);
            if (!fixMode) {
                continue;
            }
            switch (device.restartOutcome()) {
                case SUCCEEDED -> report.restartSuccess(device);
                case FAILED -> report.restartFailure(device);
                case NOT_ATTEMPTED -> report.unattemptedRestart(device);
            }
        }
        return report.totals(totals).build();
    }
}
