package com.evpn.auditor.models;

/**
 * Итог попытки перезапуска routing-процесса для устройства с отклонёнными маршрутами.
 */
public enum RestartOutcome {
    SUCCEEDED("SUCCESS"),
    FAILED("FAILED"),
    NOT_ATTEMPTED("NO");

    private final String marker;

    RestartOutcome(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    public static RestartOutcome of(DeviceResult result) {
        if (!result.isRestartAttempted()) {
            return NOT_ATTEMPTED;
        }
        return result.isRestartSucceeded() ? SUCCEEDED : FAILED;
    }
}
