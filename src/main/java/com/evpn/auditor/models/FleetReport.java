package com.evpn.auditor.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Сводный отчёт по парку устройств. Полностью выводится из набора {@link DeviceResult}
 * и нигде не сохраняется.
 */
@Value
@Builder
public class FleetReport {

    boolean fixMode;

    /**
     * Все устройства, отсортированные по метке {@code <name>:<host>}.
     */
    @Singular
    List<DeviceResult> devices;

    @Builder.Default
    RouteStatusCounts totals = RouteStatusCounts.empty();

    @Singular
    List<DeviceResult> rejectedDevices;

    @Singular
    List<DeviceResult> connectionFailures;

    // Разбивка заполняется только в fix-режиме
    @Singular("restartSuccess")
    List<DeviceResult> restartSuccesses;

    @Singular("restartFailure")
    List<DeviceResult> restartFailures;

    @Singular("unattemptedRestart")
    List<DeviceResult> unattemptedRestarts;

    public int getDeviceCount() {
        return devices.size();
    }

    public boolean hasRejected() {
        return !rejectedDevices.isEmpty();
    }
}
