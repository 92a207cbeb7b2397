package com.evpn.auditor.core;

import com.evpn.auditor.config.AuditorRules;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Явные настройки одного прогона по парку.
 */
@Value
@Builder
public class FleetRunSettings {

    public static final int DEFAULT_CONCURRENCY = 10;

    @Builder.Default
    int concurrencyLimit = DEFAULT_CONCURRENCY;

    /**
     * Таймаут подключения для всех устройств прогона; null - у каждого устройства свой.
     */
    Duration perConnectionTimeout;

    boolean fixModeEnabled;

    /**
     * CLI override важнее правил, правила важнее значения по умолчанию.
     */
    public static FleetRunSettings resolve(AuditorRules rules, Integer concurrencyOverride, boolean fixMode) {
        AuditorRules.Performance performance = rules != null && rules.getPerformance() != null
            ? rules.getPerformance()
            : new AuditorRules.Performance();

        int concurrency = DEFAULT_CONCURRENCY;
        if (concurrencyOverride != null && concurrencyOverride > 0) {
            concurrency = concurrencyOverride;
        } else if (performance.getMaxConcurrentDevices() != null && performance.getMaxConcurrentDevices() > 0) {
            concurrency = performance.getMaxConcurrentDevices();
        }

        Duration timeout = null;
        if (performance.getConnectionTimeout() != null && performance.getConnectionTimeout() > 0) {
            timeout = Duration.ofSeconds(performance.getConnectionTimeout());
        }

        return FleetRunSettings.builder()
            .concurrencyLimit(concurrency)
            .perConnectionTimeout(timeout)
            .fixModeEnabled(fixMode)
            .build();
    }
}
