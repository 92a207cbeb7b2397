package com.evpn.auditor.core;

import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.models.DeviceResult;
import com.evpn.auditor.models.RouteStatusCounts;
import com.evpn.auditor.transport.DeviceTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.BiFunction;

/**
 * Обработка одного устройства:
 * подключение, запрос статусов, решение о перезапуске, отключение.
 *
 * <p>Результат формируется всегда, в том числе при сбое. Перезапуск выполняется
 * только если включён fix-режим и есть отклонённые маршруты. После успешного
 * подключения disconnect вызывается ровно один раз на любом пути выхода.
 */
@Slf4j
public class DeviceWorkflow {

    enum State { INIT, CONNECTING, CONNECT_FAILED, QUERYING, QUERIED, RESTARTING, DONE }

    private final BiFunction<DeviceTransport, DeviceDescriptor, DeviceSession> sessionFactory;
    private final DeviceTransport transport;
    private final boolean fixMode;
    private final Duration connectTimeoutOverride;

    public DeviceWorkflow(DeviceTransport transport, FleetRunSettings settings) {
        this(transport, settings, DeviceSession::new);
    }

    DeviceWorkflow(DeviceTransport transport, FleetRunSettings settings,
                   BiFunction<DeviceTransport, DeviceDescriptor, DeviceSession> sessionFactory) {
        this.transport = transport;
        this.fixMode = settings.isFixModeEnabled();
        this.connectTimeoutOverride = settings.getPerConnectionTimeout();
        this.sessionFactory = sessionFactory;
    }

    public DeviceResult run(DeviceDescriptor descriptor) {
        DeviceDescriptor effective = applyTimeoutOverride(descriptor);
        DeviceResult.DeviceResultBuilder result = DeviceResult.builder()
            .host(effective.getHost())
            .displayName(effective.getDisplayName())
            .connected(false);

        DeviceSession session = sessionFactory.apply(transport, effective);
        transition(effective, State.INIT, State.CONNECTING);
        if (!session.connect()) {
            transition(effective, State.CONNECTING, State.CONNECT_FAILED);
            transition(effective, State.CONNECT_FAILED, State.DONE);
            return result.build();
        }
        result.connected(true);

        try {
            transition(effective, State.CONNECTING, State.QUERYING);
            RouteStatusCounts counts = session.queryRouteStatus();
            result.statusCounts(counts);
            transition(effective, State.QUERYING, State.QUERIED);

            if (fixMode && counts.getRejected() > 0) {
                log.info("Найдено {} отклонённых маршрутов на {}", counts.getRejected(), effective.getHost());
                transition(effective, State.QUERIED, State.RESTARTING);
                result.restartAttempted(true);
                result.restartSucceeded(session.restartRouting());
            }
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка при обработке {}: {}", effective.getHost(), e.toString(), e);
            result.restartSucceeded(false);
        } finally {
            session.disconnect();
            log.debug("{}: -> {}", effective.getHost(), State.DONE);
        }
        return result.build();
    }

    private DeviceDescriptor applyTimeoutOverride(DeviceDescriptor descriptor) {
        if (connectTimeoutOverride == null) {
            return descriptor;
        }
        return descriptor.toBuilder()
            .connectTimeoutSeconds((int) Math.max(1, connectTimeoutOverride.getSeconds()))
            .build();
    }

    private void transition(DeviceDescriptor descriptor, State from, State to) {
        log.debug("{}: {} -> {}", descriptor.getHost(), from, to);
    }
}
