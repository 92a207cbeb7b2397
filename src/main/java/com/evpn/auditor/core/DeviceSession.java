package com.evpn.auditor.core;

import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.models.RouteStatusCounts;
import com.evpn.auditor.transport.DeviceChannel;
import com.evpn.auditor.transport.DeviceTransport;
import com.evpn.auditor.transport.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Жизненный цикл подключения к одному устройству и две удалённые операции.
 * Вызывающий код никогда не видит исключений транспорта: только boolean / нулевые счётчики
 * и запись в лог.
 */
public class DeviceSession {

    private final DeviceTransport transport;
    private final DeviceDescriptor descriptor;
    private final Logger log;
    private final RouteStatusClassifier classifier;

    private DeviceChannel channel;

    public DeviceSession(DeviceTransport transport, DeviceDescriptor descriptor) {
        this.transport = transport;
        this.descriptor = descriptor;
        this.log = LoggerFactory.getLogger("evpn." + descriptor.getDisplayName());
        this.classifier = new RouteStatusClassifier(log);
    }

    public boolean isConnected() {
        return channel != null && channel.isOpen();
    }

    /**
     * Подключиться в пределах connectTimeoutSeconds дескриптора.
     */
    public boolean connect() {
        if (isConnected()) {
            return true;
        }
        Duration timeout = Duration.ofSeconds(Math.max(1, descriptor.getConnectTimeoutSeconds()));
        OperationResult<DeviceChannel> opened;
        try {
            opened = transport.open(descriptor, timeout);
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка подключения к {}: {}", descriptor.getHost(), e.toString());
            return false;
        }
        if (opened instanceof OperationResult.Success<DeviceChannel> success) {
            channel = success.value();
            log.info("Подключено к {}", descriptor.getHost());
            return true;
        }
        OperationResult.Failure<DeviceChannel> failure = (OperationResult.Failure<DeviceChannel>) opened;
        log.error("Ошибка подключения к {}: {}", descriptor.getHost(), failure.describe());
        return false;
    }

    /**
     * Один запрос статусов EVPN маршрутов. При любой ошибке - нулевые счётчики,
     * частичный результат не возвращается.
     */
    public RouteStatusCounts queryRouteStatus() {
        if (!isConnected()) {
            log.error("Устройство {} не подключено", descriptor.getHost());
            return RouteStatusCounts.empty();
        }
        try {
            OperationResult<List<String>> reply = channel.queryRouteStatuses();
            if (reply instanceof OperationResult.Success<List<String>> success) {
                List<String> tokens = success.value();
                log.debug("Найдено {} элементов статуса маршрута", tokens.size());
                RouteStatusCounts counts = classifier.classify(tokens);
                log.info("Статус EVPN маршрутов на {}: {}", descriptor.getHost(), counts);
                return counts;
            }
            OperationResult.Failure<List<String>> failure = (OperationResult.Failure<List<String>>) reply;
            log.error("Ошибка RPC при получении статуса EVPN с {}: {}", descriptor.getHost(), failure.describe());
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка получения статуса EVPN с {}: {}", descriptor.getHost(), e.toString());
        }
        return RouteStatusCounts.empty();
    }

    public boolean restartRouting() {
        if (!isConnected()) {
            log.error("Устройство {} не подключено", descriptor.getHost());
            return false;
        }
        try {
            log.warn("Перезапуск routing-процесса на {}", descriptor.getHost());
            OperationResult<Void> reply = channel.restartRouting();
            if (reply.isSuccess()) {
                log.info("Перезапуск routing инициирован на {}", descriptor.getHost());
                return true;
            }
            log.error("Не удалось перезапустить routing на {}: {}", descriptor.getHost(),
                ((OperationResult.Failure<Void>) reply).describe());
        } catch (RuntimeException e) {
            log.error("Непредвиденная ошибка перезапуска routing на {}: {}", descriptor.getHost(), e.toString());
        }
        return false;
    }

    /**
     * Закрыть сессию. Безопасно вызывать повторно и без подключения.
     */
    public void disconnect() {
        DeviceChannel current = channel;
        channel = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
            log.info("Отключено от {}", descriptor.getHost());
        } catch (RuntimeException e) {
            log.warn("Ошибка при отключении от {}: {}", descriptor.getHost(), e.toString());
        }
    }
}
