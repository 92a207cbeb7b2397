package com.evpn.auditor.cli;

import com.evpn.auditor.config.AuditorRules;
import com.evpn.auditor.config.LoggingConfigurator;
import com.evpn.auditor.core.FleetAuditor;
import com.evpn.auditor.models.FleetReport;
import com.evpn.auditor.reports.JsonReportGenerator;
import com.evpn.auditor.reports.TextReportGenerator;
import com.evpn.auditor.transport.DeviceTransport;
import com.evpn.auditor.transport.netconf.NetconfSshTransport;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Главная CLI команда: проверка статуса EVPN маршрутов на устройствах Juniper
 */
@Slf4j
@Command(
    name = "evpn-auditor",
    mixinStandardHelpOptions = true,
    version = "EVPN Route Auditor 1.0.0",
    description = "EVPN Route Status Manager for Juniper devices",
    footer = {
        "",
        "Examples:",
        "  # Check EVPN status on all devices",
        "  evpn-auditor --hosts-file data/hosts.yaml --rules-file data/rules.yaml",
        "",
        "  # Check status and fix rejected routes",
        "  evpn-auditor --hosts-file data/hosts.yaml --rules-file data/rules.yaml --fix",
        "",
        "  # Enable debug logging (rules file uses default)",
        "  evpn-auditor --hosts-file data/hosts.yaml --log-level DEBUG"
    }
)
public class MainCommand implements Callable<Integer> {

    public enum LogLevel { DEBUG, INFO, WARNING, ERROR }

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"--hosts-file"},
        description = "YAML file containing device inventory (default: ${DEFAULT-VALUE})",
        defaultValue = "data/hosts.yaml"
    )
    private Path hostsFile;

    @Option(
        names = {"--rules-file"},
        description = "YAML file with EVPN validation rules (default: ${DEFAULT-VALUE})",
        defaultValue = "data/rules.yaml"
    )
    private Path rulesFile;

    @Option(
        names = {"--fix"},
        description = "Restart routing on devices with rejected routes"
    )
    private boolean fix = false;

    @Option(
        names = {"--log-level"},
        description = "Logging level: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "INFO"
    )
    private LogLevel logLevel;

    private Integer maxConcurrent;

    @Option(
        names = {"--max-concurrent"},
        description = "Maximum concurrent device connections (overrides rules.yaml setting)"
    )
    void setMaxConcurrent(Integer value) {
        if (value != null && value < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--max-concurrent must be a positive integer, got " + value);
        }
        this.maxConcurrent = value;
    }

    @Option(
        names = {"--report-json"},
        description = "Write the fleet report as JSON to this file"
    )
    private Path reportJson;

    private final Function<AuditorRules, DeviceTransport> transportFactory;

    public MainCommand() {
        this(rules -> new NetconfSshTransport(rules.getNetconf()));
    }

    MainCommand(Function<AuditorRules, DeviceTransport> transportFactory) {
        this.transportFactory = transportFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LoggingConfigurator.applyLevel(logLevel.name());

        if (!Files.exists(hostsFile)) {
            err.println("Error: Hosts file '" + hostsFile + "' not found");
            return 1;
        }
        if (!Files.exists(rulesFile)) {
            err.println("Error: Rules file '" + rulesFile + "' not found");
            return 1;
        }

        try {
            AuditorRules rules = AuditorRules.load(rulesFile);
            try {
                LoggingConfigurator.applyRules(rules.getLogging());
            } catch (IOException e) {
                log.warn("Не удалось настроить файл лога из правил: {}", e.getMessage());
            }

            FleetAuditor auditor = new FleetAuditor(hostsFile, rules, transportFactory.apply(rules), fix, maxConcurrent);
            FleetReport report = auditor.run();

            out.print(new TextReportGenerator().render(report));
            out.flush();

            if (reportJson != null) {
                new JsonReportGenerator().generate(report, reportJson);
            }
            return 0;
        } catch (Exception e) {
            err.println("Unexpected error: " + e.getMessage());
            log.error("Непредвиденная ошибка: {}", e.getMessage(), e);
            return 1;
        }
    }
}
