package com.example.schedulerservice.metrics;

import com.example.schedulerservice.store.JobStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort additive copy of metric changes in the store. Writes run on one
 * background thread so storage latency never reaches a tick or a registration;
 * a failed write is logged and lost.
 */
@Slf4j
public class DurableMetricsMirror implements AutoCloseable {
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final JobStore store;
    private final ExecutorService writer;

    public DurableMetricsMirror(JobStore store) {
        this.store = store;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-mirror");
            t.setDaemon(true);
            return t;
        });
    }

    public void add(MetricName name, String jobName, double delta) {
        String job = name.isJobScoped() ? jobName : "";
        try {
            writer.execute(() -> write(name, job, delta));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping durable update of {} after shutdown", name.getMetricName());
        }
    }

    /** Waits until every update queued so far has been attempted. */
    public void flush(Duration timeout) {
        try {
            writer.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Mirror already closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Metrics mirror did not drain within {}ms", timeout.toMillis());
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Metrics mirror still had pending writes at shutdown");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }

    private void write(MetricName name, String jobName, double delta) {
        try {
            store.addToMetric(name.getMetricName(), jobName, delta);
        } catch (RuntimeException e) {
            log.warn("Failed to mirror {}{} += {}: {}", name.getMetricName(),
                    jobName.isEmpty() ? "" : "{" + jobName + "}", delta, e.getMessage());
        }
    }
}
