package com.example.schedulerservice.store;

/**
 * One persisted metric value. Global metrics carry an empty job name.
 */
public class MetricRow {
    private final String metricName;
    private final String jobName;
    private final double value;

    public MetricRow(String metricName, String jobName, double value) {
        this.metricName = metricName;
        this.jobName = jobName == null ? "" : jobName;
        this.value = value;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getJobName() {
        return jobName;
    }

    public boolean isGlobal() {
        return jobName.isEmpty();
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "MetricRow{" + metricName + (isGlobal() ? "" : "{" + jobName + "}") + "=" + value + "}";
    }
}
