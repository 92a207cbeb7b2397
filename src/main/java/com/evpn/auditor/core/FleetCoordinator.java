package com.evpn.auditor.core;

import com.evpn.auditor.models.DeviceDescriptor;
import com.evpn.auditor.models.DeviceResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Параллельный запуск {@link DeviceWorkflow} по всем устройствам под общим лимитом.
 *
 * <p>Устройства независимы: сбой одного не отменяет и не портит результаты остальных.
 * Порядок результатов не гарантируется; каждый результат несёт host/имя своего дескриптора.
 */
@Slf4j
public class FleetCoordinator {

    private final DeviceWorkflow workflow;
    private final FleetRunSettings settings;

    private volatile AdmissionGate lastGate;

    public FleetCoordinator(DeviceWorkflow workflow, FleetRunSettings settings) {
        this.workflow = workflow;
        this.settings = settings;
    }

    public List<DeviceResult> dispatch(List<DeviceDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            log.info("Нет устройств для обработки");
            return List.of();
        }

        int limit = Math.max(1, settings.getConcurrencyLimit());
        AdmissionGate gate = new AdmissionGate(limit);
        lastGate = gate;
        log.info("Обработка {} устройств (fix_mode: {}, max_concurrent: {})",
            descriptors.size(), settings.isFixModeEnabled(), limit);

        Queue<DeviceResult> sink = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(limit, descriptors.size()), new WorkerThreadFactory());
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(descriptors.size());
            for (DeviceDescriptor descriptor : descriptors) {
                CompletableFuture<Void> future = CompletableFuture
                    .supplyAsync(() -> runAdmitted(gate, descriptor), executor)
                    .exceptionally(error -> {
                        log.error("Сбой обработки устройства {}: {}", descriptor.getHost(), error.toString());
                        return DeviceResult.unconnected(descriptor);
                    })
                    .thenAccept(sink::add);
                futures.add(future);
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            shutdown(executor);
        }

        log.info("Обработка завершена: {} результатов, пик параллельности {}", sink.size(), gate.getPeakInFlight());
        return new ArrayList<>(sink);
    }

    /**
     * Шлюз последнего прогона (для диагностики).
     */
    AdmissionGate getLastGate() {
        return lastGate;
    }

    private DeviceResult runAdmitted(AdmissionGate gate, DeviceDescriptor descriptor) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ожидание слота для {} прервано", descriptor.getHost());
            return DeviceResult.unconnected(descriptor);
        }
        try {
            return workflow.run(descriptor);
        } finally {
            gate.release();
        }
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Пул обработчиков не завершился за 60 секунд, принудительное закрытие");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "evpn-device-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
