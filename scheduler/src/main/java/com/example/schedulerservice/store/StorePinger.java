package com.example.schedulerservice.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks that the store still answers.
 */
@Slf4j
public class StorePinger implements AutoCloseable {
    private final JobStore store;
    private final ScheduledExecutorService executor;

    public StorePinger(JobStore store) {
        this.store = store;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "store-ping");
            t.setDaemon(true);
            return t;
        });
    }

    public void start(Duration interval) {
        long ms = interval.toMillis();
        executor.scheduleWithFixedDelay(this::pingOnce, ms, ms, TimeUnit.MILLISECONDS);
    }

    boolean pingOnce() {
        try {
            store.ping();
            log.debug("Store ping ok");
            return true;
        } catch (StoreException e) {
            log.warn("Store ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
