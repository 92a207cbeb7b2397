package com.evpn.auditor.models;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Set;

/**
 * Идентичность и учётные данные одного управляемого устройства.
 * Создаётся при загрузке инвентаря и больше не меняется.
 */
@Value
@Builder(toBuilder = true)
public class DeviceDescriptor {

    public static final int DEFAULT_PORT = 22;
    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 30;

    String host;
    String displayName;
    String username;

    @ToString.Exclude
    String password;

    @Builder.Default
    int port = DEFAULT_PORT;

    @Builder.Default
    int connectTimeoutSeconds = DEFAULT_CONNECT_TIMEOUT_SECONDS;

    @Singular
    Set<String> tags;

    public String getDisplayName() {
        return displayName != null && !displayName.isBlank() ? displayName : host;
    }

    /**
     * Метка устройства в отчёте: {@code <name>:<host>}.
     */
    public String label() {
        return getDisplayName() + ":" + host;
    }
}
