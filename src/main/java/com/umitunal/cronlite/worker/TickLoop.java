package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for an external timer service: calls a driver's
 * {@link TriggerDriver#dispatchOnceCycle()} with a fixed delay between cycles. A cycle only
 * claims and starts runs, so a slow handler never holds back the next cycle.
 */
public class TickLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TickLoop.class);

    private final TriggerDriver driver;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong(0);
    private final AtomicLong failedCycles = new AtomicLong(0);

    public TickLoop(TriggerDriver driver, Duration interval) {
        this.driver = driver;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("cronlite-tick", false));
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Tick loop started, every {}", interval);
        }
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        try {
            driver.dispatchOnceCycle();
            cycles.incrementAndGet();
        } catch (StoreUnavailableException e) {
            // Next cycle tries again; due jobs stay due
            failedCycles.incrementAndGet();
            log.error("Tick skipped, store unavailable: {}", e.getMessage());
        } catch (RuntimeException e) {
            failedCycles.incrementAndGet();
            log.error("Tick failed", e);
        }
    }

    public long getCycleCount() { return cycles.get(); }
    public long getFailedCycleCount() { return failedCycles.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }
}
