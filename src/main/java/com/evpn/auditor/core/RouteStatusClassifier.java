package com.evpn.auditor.core;

import com.evpn.auditor.models.RouteStatus;
import com.evpn.auditor.models.RouteStatusCounts;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

/**
 * Классификация сырых статусов маршрутов в фиксированный набор категорий.
 *
 * <p>Каждый токен обрезается; пустой или отсутствующий считается "Unknown".
 * Нераспознанное значение увеличивает Unknown и логируется как предупреждение:
 * это сигнал о новом значении протокола на устройстве.
 * Сумма счётчиков всегда равна числу входных токенов.
 */
@Slf4j
public class RouteStatusClassifier {

    private final Logger logger;

    public RouteStatusClassifier() {
        this(log);
    }

    /**
     * @param logger логгер устройства, чтобы предупреждения были привязаны к хосту
     */
    public RouteStatusClassifier(Logger logger) {
        this.logger = logger != null ? logger : log;
    }

    public RouteStatusCounts classify(List<String> tokens) {
        EnumMap<RouteStatus, Integer> counts = new EnumMap<>(RouteStatus.class);
        if (tokens == null) {
            return RouteStatusCounts.empty();
        }
        for (String raw : tokens) {
            String token = raw != null ? raw.trim() : "";
            if (token.isEmpty()) {
                token = RouteStatus.UNKNOWN.getLabel();
            }
            logger.debug("Статус маршрута: {}", token);
            Optional<RouteStatus> status = RouteStatus.fromToken(token);
            if (status.isPresent()) {
                counts.merge(status.get(), 1, Integer::sum);
            } else {
                counts.merge(RouteStatus.UNKNOWN, 1, Integer::sum);
                logger.warn("Неизвестный статус маршрута: {}", token);
            }
        }
        return RouteStatusCounts.of(counts);
    }
}
