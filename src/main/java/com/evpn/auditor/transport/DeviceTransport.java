package com.evpn.auditor.transport;

import com.evpn.auditor.models.DeviceDescriptor;

import java.time.Duration;

/**
 * Возможность подключения к устройству по протоколу управления.
 * Реализация обязана сама освободить промежуточные ресурсы, если подключение сорвалось на полпути.
 */
public interface DeviceTransport {

    OperationResult<DeviceChannel> open(DeviceDescriptor descriptor, Duration connectTimeout);
}
