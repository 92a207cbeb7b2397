package com.evpn.auditor.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Счётчики статусов маршрутов одного устройства.
 * Все пять категорий присутствуют всегда, отсутствующие равны 0.
 * Экземпляр неизменяем после создания.
 */
@EqualsAndHashCode
public final class RouteStatusCounts {

    private static final RouteStatusCounts EMPTY = new RouteStatusCounts(new EnumMap<>(RouteStatus.class));

    private final EnumMap<RouteStatus, Integer> counts;

    private RouteStatusCounts(EnumMap<RouteStatus, Integer> source) {
        EnumMap<RouteStatus, Integer> copy = new EnumMap<>(RouteStatus.class);
        for (RouteStatus status : RouteStatus.values()) {
            int value = source.getOrDefault(status, 0);
            if (value < 0) {
                throw new IllegalArgumentException("Отрицательный счётчик для " + status.getLabel() + ": " + value);
            }
            copy.put(status, value);
        }
        this.counts = copy;
    }

    public static RouteStatusCounts empty() {
        return EMPTY;
    }

    public static RouteStatusCounts of(Map<RouteStatus, Integer> values) {
        EnumMap<RouteStatus, Integer> source = new EnumMap<>(RouteStatus.class);
        if (values != null) {
            values.forEach((status, count) -> {
                if (status != null && count != null) {
                    source.put(status, count);
                }
            });
        }
        return new RouteStatusCounts(source);
    }

    public int get(RouteStatus status) {
        return counts.get(status);
    }

    public int getAccepted() {
        return get(RouteStatus.ACCEPTED);
    }

    public int getRejected() {
        return get(RouteStatus.REJECTED);
    }

    public int getPending() {
        return get(RouteStatus.PENDING);
    }

    public int getInvalid() {
        return get(RouteStatus.INVALID);
    }

    public int getUnknown() {
        return get(RouteStatus.UNKNOWN);
    }

    public int total() {
        int sum = 0;
        for (int value : counts.values()) {
            sum += value;
        }
        return sum;
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    public RouteStatusCounts plus(RouteStatusCounts other) {
        if (other == null) {
            return this;
        }
        EnumMap<RouteStatus, Integer> sum = new EnumMap<>(RouteStatus.class);
        for (RouteStatus status : RouteStatus.values()) {
            sum.put(status, get(status) + other.get(status));
        }
        return new RouteStatusCounts(sum);
    }

    /**
     * Ненулевые категории в порядке объявления, ключ - метка протокола.
     */
    public Map<String, Integer> nonZero() {
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.forEach((status, value) -> {
            if (value > 0) {
                result.put(status.getLabel(), value);
            }
        });
        return result;
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        Map<String, Integer> result = new LinkedHashMap<>();
        counts.forEach((status, value) -> result.put(status.getLabel(), value));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
