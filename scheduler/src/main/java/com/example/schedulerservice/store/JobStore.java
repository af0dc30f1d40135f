package com.example.schedulerservice.store;

import com.example.schedulerservice.jobs.Job;

import java.util.List;

/**
 * Durable copy of the job set and of the metric counters.
 * All methods throw {@link StoreException} on storage failure.
 */
public interface JobStore extends AutoCloseable {

    List<Job> loadJobs();

    /**
     * @throws com.example.schedulerservice.jobs.DuplicateJobException if a row with the name exists
     * @throws StoreException on any other database failure
     */
    void insertJob(Job job);

    /** @return false when no row existed for the name */
    boolean deleteJob(String name);

    List<MetricRow> loadMetrics();

    /** Adds {@code delta} to the stored value, creating the row at {@code delta} if absent. */
    void addToMetric(String metricName, String jobName, double delta);

    void ping();

    @Override
    void close();
}
