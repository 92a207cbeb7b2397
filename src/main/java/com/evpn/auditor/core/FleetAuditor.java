package com.evpn.auditor.core;

import com.evpn.auditor.config.AuditorRules;
import com.evpn.auditor.config.InventoryLoader;
import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.models.DeviceResult;
import com.evpn.auditor.models.FleetReport;
import com.evpn.auditor.reports.ReportAggregator;
import com.evpn.auditor.transport.DeviceTransport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Полный прогон аудита: инвентарь, параллельная обработка, свёртка в отчёт.
 */
@Slf4j
public class FleetAuditor {

    private final Path hostsFile;
    private final DeviceTransport transport;
    private final FleetRunSettings settings;
    private final ReportAggregator aggregator = new ReportAggregator();

    public FleetAuditor(Path hostsFile, AuditorRules rules, DeviceTransport transport,
                        boolean fixMode, Integer concurrencyOverride) {
        this(hostsFile, transport, FleetRunSettings.resolve(rules, concurrencyOverride, fixMode));
    }

    public FleetAuditor(Path hostsFile, DeviceTransport transport, FleetRunSettings settings) {
        this.hostsFile = hostsFile;
        this.transport = transport;
        this.settings = settings;
    }

    public FleetReport run() {
        List<DeviceDescriptor> devices = new InventoryLoader(hostsFile).load();
        if (devices.isEmpty()) {
            log.error("Не загружено ни одного устройства");
            return aggregator.aggregate(List.of(), settings.isFixModeEnabled());
        }

        FleetCoordinator coordinator = new FleetCoordinator(new DeviceWorkflow(transport, settings), settings);
        List<DeviceResult> results = coordinator.dispatch(devices);
        return aggregator.aggregate(results, settings.isFixModeEnabled());
    }
}
