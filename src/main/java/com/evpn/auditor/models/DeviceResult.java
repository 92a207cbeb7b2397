package com.evpn.auditor.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * Итог обработки одного устройства.
 *
 * <p>restartAttempted возможен только при connected; restartSucceeded без попытки всегда false.
 */
@Value
@Builder
public class DeviceResult {

    String host;
    String displayName;
    boolean connected;

    @Builder.Default
    RouteStatusCounts statusCounts = RouteStatusCounts.empty();

    boolean restartAttempted;
    boolean restartSucceeded;

    /**
     * Результат для устройства, к которому не удалось подключиться.
     */
    public static DeviceResult unconnected(DeviceDescriptor descriptor) {
        return DeviceResult.builder()
            .host(descriptor.getHost())
            .displayName(descriptor.getDisplayName())
            .connected(false)
            .build();
    }

    @JsonIgnore
    public String label() {
        return displayName + ":" + host;
    }

    /**
     * Устройство требует внимания, если на нём есть отклонённые маршруты (независимо от fix-режима).
     */
    @JsonIgnore
    public boolean needsAttention() {
        return statusCounts.getRejected() > 0;
    }

    @JsonIgnore
    public RestartOutcome restartOutcome() {
        return RestartOutcome.of(this);
    }
}
