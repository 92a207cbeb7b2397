package com.evpn.auditor.models;

import java.util.Optional;

/**
 * Статусы приёма EVPN маршрута, как их сообщает control plane устройства.
 * UNKNOWN собирает все нераспознанные значения.
 */
public enum RouteStatus {
    ACCEPTED("Accepted"),
    REJECTED("Rejected"),
    PENDING("Pending"),
    INVALID("Invalid"),
    UNKNOWN("Unknown");

    private final String label;

    RouteStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Точное (регистрозависимое) сопоставление токена устройства.
     * "Unknown" здесь не распознаётся: это служебная категория, а не значение протокола.
     */
    public static Optional<RouteStatus> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (RouteStatus status : values()) {
            if (status != UNKNOWN && status.label.equals(token)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
