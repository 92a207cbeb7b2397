package com.evpn.auditor.cli;

import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.transport.DeviceChannel;
import com.evpn.auditor.transport.DeviceTransport;
import com.evpn.auditor.transport.OperationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path hostsFile;
    private Path rulesFile;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        hostsFile = tempDir.resolve("hosts.yaml");
        Files.writeString(hostsFile, String.join("\n",
            "defaults:",
            "  admin_user: netops",
            "  user_password:",
            "    netops: secret",
            "host_groups:",
            "  spines:",
            "    - host: 10.0.0.1",
            "      name: spine-1",
            "    - host: 10.0.0.2",
            "      name: spine-2",
            ""));
        rulesFile = tempDir.resolve("rules.yaml");
        Files.writeString(rulesFile, String.join("\n",
            "performance:",
            "  max_concurrent_devices: 2",
            ""));
    }

    /**
     * Транспорт со статическими ответами: spine-1 с отклонёнными маршрутами, spine-2 недоступен.
     */
    private static DeviceTransport staticTransport() {
        Map<String, List<String>> tokens = Map.of("10.0.0.1", List.of("Accepted", "Rejected"));
        return (DeviceDescriptor descriptor, Duration timeout) -> {
            List<String> reply = tokens.get(descriptor.getHost());
            if (reply == null) {
                return OperationResult.failure("connection refused");
            }
            return OperationResult.success(new DeviceChannel() {
                private boolean open = true;

                @Override
                public OperationResult<List<String>> queryRouteStatuses() {
                    return OperationResult.success(reply);
                }

                @Override
                public OperationResult<Void> restartRouting() {
                    return OperationResult.success(null);
                }

                @Override
                public boolean isOpen() {
                    return open;
                }

                @Override
                public void close() {
                    open = false;
                }
            });
        };
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new MainCommand(rules -> staticTransport()));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void auditWithoutFixPrintsSummaryAndHint() {
        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString());

        assertEquals(0, exitCode);
        String report = out.toString();
        assertTrue(report.contains("EVPN Route Status Summary:"));
        assertTrue(report.contains("spine-1:10.0.0.1"));
        assertTrue(report.contains("Accepted: 1, Rejected: 1"));
        assertTrue(report.contains("CONNECTION FAILED"));
        assertTrue(report.contains("To fix rejected routes, run with --fix option"));
    }

    @Test
    void fixModeReportsRestart() {
        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString(), "--fix");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("[Restart: SUCCESS]"));
        assertTrue(out.toString().contains("Successfully restarted routing on 1 device(s):"));
    }

    @Test
    void writesJsonReportWhenRequested() throws IOException {
        Path json = tempDir.resolve("reports/fleet.json");

        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString(),
            "--report-json", json.toString());

        assertEquals(0, exitCode);
        JsonNode root = new ObjectMapper().readTree(json.toFile());
        assertEquals(2, root.path("report").path("devices").size());
    }

    @Test
    void missingHostsFileExitsWithOne() {
        int exitCode = execute("--hosts-file", tempDir.resolve("absent.yaml").toString(),
            "--rules-file", rulesFile.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Hosts file"));
    }

    @Test
    void missingRulesFileExitsWithOne() {
        int exitCode = execute("--hosts-file", hostsFile.toString(),
            "--rules-file", tempDir.resolve("absent.yaml").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Rules file"));
    }

    @Test
    void nonPositiveConcurrencyIsUsageError() {
        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString(),
            "--max-concurrent", "0");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("--max-concurrent"));
    }

    @Test
    void explicitConcurrencyIsAccepted() {
        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString(),
            "--max-concurrent", "1");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("spine-2:10.0.0.2"));
    }

    @Test
    void unknownLogLevelIsUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, execute("--log-level", "TRACE"));
    }

    @Test
    void emptyInventoryStillPrintsReport() throws IOException {
        Files.writeString(hostsFile, "host_groups: {}\n");

        int exitCode = execute("--hosts-file", hostsFile.toString(), "--rules-file", rulesFile.toString());

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("Total routes: No routes found"));
    }
}
