package com.evpn.auditor.transport;

import java.util.List;

/**
 * Открытая сессия управления с одним устройством.
 */
public interface DeviceChannel extends AutoCloseable {

    /**
     * Запрос базы EVPN IP-префиксов. Возвращает сырые значения статусов маршрутов
     * в порядке следования в ответе (пустой текст элемента - пустая строка).
     */
    OperationResult<List<String>> queryRouteStatuses();

    /**
     * Перезапуск routing-процесса на устройстве.
     */
    OperationResult<Void> restartRouting();

    boolean isOpen();

    /**
     * Закрывает сессию и освобождает связанные ресурсы. Повторный вызов безопасен.
     */
    @Override
    void close();
}
