package com.example.schedulerservice.metrics;

import java.util.Optional;

/**
 * Every metric the scheduler exports and mirrors to the store. The exported name
 * doubles as the {@code metric_name} column value.
 */
public enum MetricName {
    JOBS_REGISTERED("scheduler_jobs_registered_total", "Total number of jobs registered", Kind.COUNTER, false),
    JOBS_ACTIVE("scheduler_jobs_active", "Current number of active jobs", Kind.GAUGE, false),
    JOB_EXECUTIONS("scheduler_job_executions_total", "Total number of job executions", Kind.COUNTER, true),
    JOB_FAILURES("scheduler_job_failures_total", "Total number of job execution failures", Kind.COUNTER, true),
    JOB_DURATION("scheduler_job_duration_seconds", "Job execution time in seconds", Kind.HISTOGRAM, true),
    EXECUTIONS("scheduler_executions_total", "Total number of successful executions across all jobs",
            Kind.COUNTER, false),
    EXECUTION_DURATION_SUM("scheduler_execution_duration_seconds_total",
            "Accumulated duration of successful executions across all jobs", Kind.COUNTER, false);

    public enum Kind {
        COUNTER, GAUGE, HISTOGRAM
    }

    private final String metricName;
    private final String help;
    private final Kind kind;
    private final boolean jobScoped;

    MetricName(String metricName, String help, Kind kind, boolean jobScoped) {
        this.metricName = metricName;
        this.help = help;
        this.kind = kind;
        this.jobScoped = jobScoped;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getHelp() {
        return help;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isJobScoped() {
        return jobScoped;
    }

    public static Optional<MetricName> fromMetricName(String name) {
        for (MetricName m : values()) {
            if (m.metricName.equals(name)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
