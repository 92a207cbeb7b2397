package com.evpn.auditor.core;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Счётный шлюз, ограничивающий число одновременно обрабатываемых устройств.
 * Захватывается до подключения и освобождается после отключения.
 */
public class AdmissionGate {

    private final int limit;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    public AdmissionGate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Лимит параллельности должен быть положительным: " + limit);
        }
        this.limit = limit;
        this.permits = new Semaphore(limit, true);
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
        int current = inFlight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    public int getLimit() {
        return limit;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Максимум одновременно допущенных работ за время жизни шлюза.
     */
    public int getPeakInFlight() {
        return peak.get();
    }
}
