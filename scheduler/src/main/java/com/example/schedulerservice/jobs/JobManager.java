package com.example.schedulerservice.jobs;

import com.example.schedulerservice.metrics.JobMetrics;
import com.example.schedulerservice.schedule.CronExpressions;
import com.example.schedulerservice.schedule.RecurrenceScheduler;
import com.example.schedulerservice.schedule.ScheduleHandle;
import com.example.schedulerservice.store.JobStore;
import com.example.schedulerservice.store.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The authoritative set of live jobs.
 * <p>
 * Register, deregister and list run under one lock. A registration is complete
 * only once both the timer and the durable row exist; if the row cannot be
 * written the timer is removed again. A deregistration deletes the row first and
 * keeps the job running if that fails. Ticks run outside the lock.
 */
@Slf4j
public class JobManager {
    private final RecurrenceScheduler scheduler;
    private final JobStore store;
    private final JobMetrics metrics;
    private final JobExecutor executor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RegisteredJob> jobs = new HashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public JobManager(RecurrenceScheduler scheduler, JobStore store, JobMetrics metrics, JobExecutor executor) {
        this.scheduler = scheduler;
        this.store = store;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Restores metrics and jobs from the store. Runs once per instance.
     *
     * @throws StoreException if the store cannot be read
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("job manager already started");
        }
        metrics.reconcile(store.loadMetrics());
        int restored = loadJobs();
        metrics.resetActiveJobs(size());
        log.info("Job manager started with {} restored jobs", restored);
    }

    /**
     * @throws DuplicateJobException if a job with the same name is live
     * @throws InvalidScheduleException if the cron expression is not valid
     * @throws InvalidJobException if name, cron or endpoint are missing, or the endpoint is malformed
     * @throws StoreException if the job could not be persisted; nothing stays scheduled
     */
    public Job register(Job job) {
        Job accepted = validate(job);
        lock.lock();
        try {
            schedule(accepted, true);
        } finally {
            lock.unlock();
        }
        metrics.jobRegistered();
        log.info("Registered {} ({})", accepted.getName(), accepted.getCron());
        return accepted;
    }

    /**
     * @throws JobNotFoundException if no live job has the name
     * @throws StoreException if the row could not be deleted; the job keeps running
     */
    public void deregister(String name) {
        lock.lock();
        try {
            RegisteredJob entry = jobs.get(name);
            if (entry == null) {
                throw new JobNotFoundException(name);
            }
            if (!store.deleteJob(name)) {
                log.warn("Job {} had no durable row", name);
            }
            scheduler.remove(entry.handle);
            jobs.remove(name);
        } finally {
            lock.unlock();
        }
        metrics.jobDeregistered();
        log.info("Deregistered {}", name);
    }

    /** Snapshot of the live jobs, sorted by name. */
    public List<Job> list() {
        List<Job> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(jobs.size());
            for (RegisteredJob entry : jobs.values()) {
                snapshot.add(copy(entry.job));
            }
        } finally {
            lock.unlock();
        }
        snapshot.sort(Comparator.comparing(Job::getName));
        return snapshot;
    }

    /**
     * Re-registers every persisted job. A job that cannot be scheduled is logged
     * and skipped so the rest still load.
     *
     * @return the number of jobs restored
     * @throws StoreException if the job table cannot be read
     */
    public int loadJobs() {
        List<Job> persisted = store.loadJobs();
        int restored = 0;
        for (Job job : persisted) {
            try {
                Job accepted = validate(job);
                lock.lock();
                try {
                    schedule(accepted, false);
                } finally {
                    lock.unlock();
                }
                restored++;
                log.info("Restored {} ({})", accepted.getName(), accepted.getCron());
            } catch (JobException | IllegalStateException e) {
                log.warn("Failed to register job {}: {}", job.getName(), e.getMessage());
            }
        }
        return restored;
    }

    public boolean contains(String name) {
        lock.lock();
        try {
            return jobs.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    /** Stops future ticks and waits up to {@code grace} for running ones. */
    public void shutdown(Duration grace) {
        scheduler.shutdown(grace);
        log.info("Job scheduler stopped");
    }

    // caller holds the lock
    private void schedule(Job job, boolean persist) {
        if (jobs.containsKey(job.getName())) {
            throw new DuplicateJobException(job.getName());
        }
        ScheduleHandle handle = scheduler.add(job.getCron(), () -> executor.execute(job));
        if (persist) {
            try {
                store.insertJob(job);
            } catch (RuntimeException e) {
                scheduler.remove(handle);
                throw e;
            }
        }
        jobs.put(job.getName(), new RegisteredJob(job, handle));
    }

    private static Job validate(Job job) {
        if (job == null) {
            throw new InvalidJobException("job is required");
        }
        if (job.getName() == null || job.getName().isBlank()) {
            throw new InvalidJobException("job name is required");
        }
        if (job.getCron() == null || job.getCron().isBlank()) {
            throw new InvalidJobException("job cron is required");
        }
        CronExpressions.parse(job.getCron());
        if (job.getEndpoint() == null || job.getEndpoint().isBlank()) {
            throw new InvalidJobException("job endpoint is required");
        }
        URI uri;
        try {
            uri = URI.create(job.getEndpoint().trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobException("job endpoint is not a valid URL: " + job.getEndpoint());
        }
        String scheme = uri.getScheme();
        if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
            throw new InvalidJobException("job endpoint must be an absolute http(s) URL: " + job.getEndpoint());
        }
        return new Job(job.getName(), job.getCron(), job.getEndpoint().trim());
    }

    private static Job copy(Job job) {
        return new Job(job.getName(), job.getCron(), job.getEndpoint());
    }

    private static final class RegisteredJob {
        private final Job job;
        private final ScheduleHandle handle;

        private RegisteredJob(Job job, ScheduleHandle handle) {
            this.job = job;
            this.handle = handle;
        }
    }
}
