package com.evpn.auditor.reports;

import com.evpn.auditor.models.DeviceResult;
import com.evpn.auditor.models.FleetReport;
import com.evpn.auditor.models.RouteStatusCounts;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Текстовый отчёт для оператора: строка на каждое устройство и итоговая сводка.
 */
@Slf4j
public class TextReportGenerator implements ReportGenerator {

    static final int LABEL_WIDTH = 30;
    static final String NO_ROUTES = "No routes found";
    static final String CONNECTION_FAILED = "CONNECTION FAILED";
    static final String FIX_HINT = "To fix rejected routes, run with --fix option";

    private static final String RULE = "=".repeat(60);

    public String render(FleetReport report) {
        StringBuilder out = new StringBuilder();
        out.append('\n').append("EVPN Route Status Summary:").append('\n');
        out.append(RULE).append('\n');

        for (DeviceResult device : report.getDevices()) {
            out.append(deviceLine(device, report.isFixMode())).append('\n');
        }

        out.append('\n').append(RULE).append('\n');
        out.append("Overall Summary:").append('\n');
        out.append("Total routes: ").append(formatCounts(report.getTotals())).append('\n');

        if (!report.getConnectionFailures().isEmpty()) {
            out.append('\n').append("Connection failures: ").append(report.getConnectionFailures().size()).append('\n');
            for (DeviceResult device : report.getConnectionFailures()) {
                out.append("  - ").append(device.label()).append('\n');
            }
        }

        if (report.hasRejected()) {
            out.append('\n').append("Devices with rejected routes: ").append(report.getRejectedDevices().size()).append('\n');
            if (report.isFixMode()) {
                appendFixBreakdown(out, report);
            } else {
                for (DeviceResult device : report.getRejectedDevices()) {
                    out.append("  - ").append(device.label()).append(": ")
                        .append(device.getStatusCounts().getRejected()).append(" rejected routes").append('\n');
                }
                out.append('\n').append(FIX_HINT).append('\n');
            }
        }
        return out.toString();
    }

    String deviceLine(DeviceResult device, boolean fixMode) {
        String label = String.format("%-" + LABEL_WIDTH + "s", device.label());
        if (!device.isConnected()) {
            return label + " - " + CONNECTION_FAILED;
        }
        String line = label + " - " + formatCounts(device.getStatusCounts());
        if (fixMode) {
            line += " [Restart: " + device.restartOutcome().getMarker() + "]";
        }
        return line;
    }

    static String formatCounts(RouteStatusCounts counts) {
        Map<String, Integer> nonZero = counts.nonZero();
        if (nonZero.isEmpty()) {
            return NO_ROUTES;
        }
        return nonZero.entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining(", "));
    }

    private void appendFixBreakdown(StringBuilder out, FleetReport report) {
        for (DeviceResult device : report.getUnattemptedRestarts()) {
            out.append("  - ").append(device.label()).append(": ")
                .append(device.getStatusCounts().getRejected()).append(" rejected routes (no fix attempted)").append('\n');
        }
        List<DeviceResult> successes = report.getRestartSuccesses();
        if (!successes.isEmpty()) {
            out.append('\n').append("Successfully restarted routing on ").append(successes.size()).append(" device(s):").append('\n');
            for (DeviceResult device : successes) {
                out.append("  - ").append(device.label()).append(": Fixed ")
                    .append(device.getStatusCounts().getRejected()).append(" rejected routes").append('\n');
            }
        }
        List<DeviceResult> failures = report.getRestartFailures();
        if (!failures.isEmpty()) {
            out.append('\n').append("Failed to restart routing on ").append(failures.size()).append(" device(s):").append('\n');
            for (DeviceResult device : failures) {
                out.append("  - ").append(device.label()).append(": ")
                    .append(device.getStatusCounts().getRejected()).append(" rejected routes (fix failed)").append('\n');
            }
        }
    }

    @Override
    public void generate(FleetReport report, Path outputPath) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("FleetReport не может быть null");
        }
        Files.writeString(outputPath, render(report), StandardCharsets.UTF_8);
        log.info("Текстовый отчет сохранен: {}", outputPath);
    }
}
