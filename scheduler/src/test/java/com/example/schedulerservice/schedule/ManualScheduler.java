package com.example.schedulerservice.schedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scheduler that parses expressions like the real one but only fires when told to.
 */
public class ManualScheduler implements RecurrenceScheduler {
    private final AtomicLong ids = new AtomicLong();
    private final Map<ScheduleHandle, Runnable> tasks = new LinkedHashMap<>();
    private boolean stopped;

    @Override
    public synchronized ScheduleHandle add(String expression, Runnable task) {
        if (stopped) {
            throw new IllegalStateException("scheduler is shut down");
        }
        CronExpressions.parse(expression);
        ScheduleHandle handle = new ScheduleHandle(ids.incrementAndGet(), expression.trim());
        tasks.put(handle, task);
        return handle;
    }

    @Override
    public synchronized void remove(ScheduleHandle handle) {
        tasks.remove(handle);
    }

    @Override
    public synchronized void shutdown(Duration grace) {
        stopped = true;
        tasks.clear();
    }

    /** Runs every live task once on the calling thread. */
    public void fireAll() {
        List<Runnable> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(tasks.values());
        }
        snapshot.forEach(Runnable::run);
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized boolean isShutdown() {
        return stopped;
    }
}
