package com.example.schedulerservice.metrics;

import com.example.schedulerservice.store.MetricRow;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Two-tier metric recording used by the engine: the in-memory collectors are
 * updated synchronously, the durable mirror asynchronously and additively.
 * {@link #reconcile(List)} is the startup step joining the two.
 */
@Slf4j
public class JobMetrics {
    private final SchedulerMetrics metrics;
    private final DurableMetricsMirror mirror;

    public JobMetrics(SchedulerMetrics metrics, DurableMetricsMirror mirror) {
        this.metrics = metrics;
        this.mirror = mirror;
    }

    public void jobRegistered() {
        metrics.incrementCounter(MetricName.JOBS_REGISTERED, null, 1);
        metrics.addToGauge(MetricName.JOBS_ACTIVE, 1);
        mirror.add(MetricName.JOBS_REGISTERED, "", 1);
        mirror.add(MetricName.JOBS_ACTIVE, "", 1);
    }

    public void jobDeregistered() {
        metrics.addToGauge(MetricName.JOBS_ACTIVE, -1);
        mirror.add(MetricName.JOBS_ACTIVE, "", -1);
    }

    public void executionSucceeded(String jobName, double seconds) {
        metrics.incrementCounter(MetricName.JOB_EXECUTIONS, jobName, 1);
        metrics.observeHistogram(MetricName.JOB_DURATION, jobName, seconds);
        metrics.incrementCounter(MetricName.EXECUTIONS, null, 1);
        metrics.incrementCounter(MetricName.EXECUTION_DURATION_SUM, null, seconds);
        mirror.add(MetricName.JOB_EXECUTIONS, jobName, 1);
        mirror.add(MetricName.EXECUTIONS, "", 1);
        mirror.add(MetricName.EXECUTION_DURATION_SUM, "", seconds);
    }

    public void executionFailed(String jobName) {
        metrics.incrementCounter(MetricName.JOB_FAILURES, jobName, 1);
        mirror.add(MetricName.JOB_FAILURES, jobName, 1);
    }

    public int reconcile(List<MetricRow> rows) {
        return metrics.reconcile(rows);
    }

    /**
     * Sets the active gauge to the number of jobs actually running after recovery
     * and corrects the durable row by the same difference.
     */
    public void resetActiveJobs(int active) {
        double previous = metrics.gaugeValue(MetricName.JOBS_ACTIVE);
        metrics.setGauge(MetricName.JOBS_ACTIVE, active);
        double drift = active - previous;
        if (drift != 0) {
            log.info("Active jobs gauge corrected from {} to {}", previous, active);
            mirror.add(MetricName.JOBS_ACTIVE, "", drift);
        }
    }
}
