package com.example.schedulerservice.schedule;

import com.cronutils.model.time.ExecutionTime;
import com.example.schedulerservice.jobs.InvalidScheduleException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RecurrenceScheduler} backed by cron-utils and a scheduled thread pool.
 * <p>
 * The scheduled pool only keeps time. Each fire books the following occurrence
 * and hands the callback to an unbounded tick pool, so a slow callback never
 * delays ticks of the same or any other schedule.
 */
@Slf4j
public class CronUtilsScheduler implements RecurrenceScheduler {
    private final ScheduledThreadPoolExecutor executor;
    private final ExecutorService ticks;
    private final Clock clock;
    private final Map<Long, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private volatile boolean stopped = false;

    public CronUtilsScheduler(int threads, ZoneId zone) {
        this(threads, Clock.system(zone));
    }

    public CronUtilsScheduler(int threads, Clock clock) {
        AtomicInteger timerIds = new AtomicInteger();
        AtomicInteger tickIds = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads),
                r -> daemon(r, "cron-timer-" + timerIds.incrementAndGet()));
        this.ticks = Executors.newCachedThreadPool(r -> daemon(r, "cron-tick-" + tickIds.incrementAndGet()));
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.clock = clock;
    }

    @Override
    public ScheduleHandle add(String expression, Runnable task) {
        if (stopped) {
            throw new IllegalStateException("scheduler is shut down");
        }
        ExecutionTime executionTime = CronExpressions.parse(expression);
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime first = executionTime.nextExecution(now)
                .orElseThrow(() -> new InvalidScheduleException(expression, null));

        ScheduleHandle handle = new ScheduleHandle(ids.incrementAndGet(), expression.trim());
        Entry entry = new Entry(handle, executionTime, task);
        entries.put(handle.getId(), entry);
        book(entry, first);
        return handle;
    }

    @Override
    public void remove(ScheduleHandle handle) {
        if (handle == null) {
            return;
        }
        Entry entry = entries.remove(handle.getId());
        if (entry != null) {
            entry.cancel();
        }
    }

    @Override
    public void shutdown(Duration grace) {
        stopped = true;
        entries.values().forEach(Entry::cancel);
        entries.clear();
        executor.shutdown();
        ticks.shutdown();
        long deadline = System.nanoTime() + grace.toNanos();
        try {
            executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
            long left = Math.max(0, deadline - System.nanoTime());
            if (!ticks.awaitTermination(left, TimeUnit.NANOSECONDS)) {
                log.warn("In-flight ticks still running after {}s grace", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    int size() {
        return entries.size();
    }

    /** Next fire time booked for the handle, empty once removed. */
    Optional<ZonedDateTime> nextFireTime(ScheduleHandle handle) {
        Entry entry = entries.get(handle.getId());
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.nextFire);
    }

    private void book(Entry entry, ZonedDateTime fireAt) {
        long delayMs = Math.max(0, Duration.between(ZonedDateTime.now(clock), fireAt).toMillis());
        synchronized (entry) {
            if (entry.cancelled || stopped) {
                return;
            }
            entry.nextFire = fireAt;
            try {
                entry.future = executor.schedule(() -> fire(entry, fireAt), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Not booking {} after shutdown", entry.handle);
            }
        }
    }

    private void fire(Entry entry, ZonedDateTime scheduledFor) {
        if (entry.cancelled) {
            return;
        }
        // base on the intended fire time so an early wake-up cannot repeat it
        ZonedDateTime base = scheduledFor.isAfter(ZonedDateTime.now(clock)) ? scheduledFor : ZonedDateTime.now(clock);
        Optional<ZonedDateTime> next = entry.executionTime.nextExecution(base);
        if (next.isPresent()) {
            book(entry, next.get());
        } else {
            log.warn("Schedule {} has no further executions", entry.handle.getExpression());
            entries.remove(entry.handle.getId());
        }
        try {
            ticks.execute(() -> runTick(entry));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping tick for {} after shutdown", entry.handle);
        }
    }

    private void runTick(Entry entry) {
        try {
            entry.task.run();
        } catch (RuntimeException e) {
            log.error("Tick for schedule {} failed", entry.handle, e);
        }
    }

    private static Thread daemon(Runnable r, String name) {
        Thread t = new Thread(r, name);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((th, ex) -> log.error("Uncaught in {}", th.getName(), ex));
        return t;
    }

    private static final class Entry {
        private final ScheduleHandle handle;
        private final ExecutionTime executionTime;
        private final Runnable task;
        private volatile boolean cancelled = false;
        private volatile ZonedDateTime nextFire;
        private ScheduledFuture<?> future;

        private Entry(ScheduleHandle handle, ExecutionTime executionTime, Runnable task) {
            this.handle = handle;
            this.executionTime = executionTime;
            this.task = task;
        }

        private synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
