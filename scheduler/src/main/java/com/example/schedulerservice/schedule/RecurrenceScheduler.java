package com.example.schedulerservice.schedule;

import com.example.schedulerservice.jobs.InvalidScheduleException;

import java.time.Duration;

/**
 * Fires a callback at every occurrence of a cron expression until the returned
 * handle is removed.
 */
public interface RecurrenceScheduler {

    /**
     * @throws InvalidScheduleException if the expression cannot be parsed or never fires
     * @throws IllegalStateException if the scheduler has been shut down
     */
    ScheduleHandle add(String expression, Runnable task);

    /**
     * Cancels future fires. A fire already running is left to complete.
     * Unknown or already removed handles are ignored.
     */
    void remove(ScheduleHandle handle);

    /**
     * Stops firing new ticks and waits up to {@code grace} for running ones.
     */
    void shutdown(Duration grace);
}
