package com.example.schedulerservice.metrics;

import com.example.schedulerservice.store.MetricRow;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local Prometheus collectors for every {@link MetricName}. These values
 * are what {@code /metrics} exports; the store only mirrors them for restarts.
 */
@Slf4j
public class SchedulerMetrics {
    public static final String JOB_LABEL = "job_name";

    private final CollectorRegistry registry;
    private final Map<MetricName, Counter> counters = new EnumMap<>(MetricName.class);
    private final Map<MetricName, Gauge> gauges = new EnumMap<>(MetricName.class);
    private final Map<MetricName, Histogram> histograms = new EnumMap<>(MetricName.class);

    public SchedulerMetrics(CollectorRegistry registry) {
        this.registry = registry;
        for (MetricName m : MetricName.values()) {
            String[] labels = m.isJobScoped() ? new String[] {JOB_LABEL} : new String[0];
            switch (m.getKind()) {
                case COUNTER:
                    counters.put(m, Counter.build()
                            .name(m.getMetricName())
                            .help(m.getHelp())
                            .labelNames(labels)
                            .register(registry));
                    break;
                case GAUGE:
                    gauges.put(m, Gauge.build()
                            .name(m.getMetricName())
                            .help(m.getHelp())
                            .labelNames(labels)
                            .register(registry));
                    break;
                case HISTOGRAM:
                    histograms.put(m, Histogram.build()
                            .name(m.getMetricName())
                            .help(m.getHelp())
                            .linearBuckets(0.1, 0.5, 10)
                            .labelNames(labels)
                            .register(registry));
                    break;
            }
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void incrementCounter(MetricName name, String jobLabel, double delta) {
        Counter counter = counters.get(name);
        if (counter == null) {
            throw new IllegalArgumentException(name + " is not a counter");
        }
        if (name.isJobScoped()) {
            counter.labels(requireLabel(name, jobLabel)).inc(delta);
        } else {
            counter.inc(delta);
        }
    }

    public void setGauge(MetricName name, double value) {
        gauge(name).set(value);
    }

    public void addToGauge(MetricName name, double delta) {
        gauge(name).inc(delta);
    }

    public double gaugeValue(MetricName name) {
        return gauge(name).get();
    }

    public void observeHistogram(MetricName name, String jobLabel, double value) {
        Histogram histogram = histograms.get(name);
        if (histogram == null) {
            throw new IllegalArgumentException(name + " is not a histogram");
        }
        histogram.labels(requireLabel(name, jobLabel)).observe(value);
    }

    /**
     * Seeds collectors from persisted rows: counters resume from the stored
     * cumulative value, gauges are set absolutely. Histograms cannot be rebuilt
     * from a single value and unknown names may come from newer versions; both
     * are skipped.
     */
    public int reconcile(List<MetricRow> rows) {
        int applied = 0;
        for (MetricRow row : rows) {
            Optional<MetricName> name = MetricName.fromMetricName(row.getMetricName());
            if (name.isEmpty()) {
                log.warn("Unknown metric {} in store, skipping", row.getMetricName());
                continue;
            }
            MetricName m = name.get();
            if (m.isJobScoped() == row.isGlobal()) {
                log.warn("Metric row {} does not match the scope of {}, skipping", row, m);
                continue;
            }
            switch (m.getKind()) {
                case COUNTER:
                    if (row.getValue() < 0) {
                        log.warn("Negative counter value in {}, skipping", row);
                        continue;
                    }
                    incrementCounter(m, row.getJobName(), row.getValue());
                    break;
                case GAUGE:
                    setGauge(m, row.getValue());
                    break;
                case HISTOGRAM:
                    log.debug("Histogram {} is not restored from the store", row);
                    continue;
            }
            applied++;
        }
        log.info("Restored {} of {} metric rows from the store", applied, rows.size());
        return applied;
    }

    private Gauge gauge(MetricName name) {
        Gauge gauge = gauges.get(name);
        if (gauge == null) {
            throw new IllegalArgumentException(name + " is not a gauge");
        }
        return gauge;
    }

    private static String requireLabel(MetricName name, String jobLabel) {
        if (jobLabel == null || jobLabel.isEmpty()) {
            throw new IllegalArgumentException(name + " requires a job name");
        }
        return jobLabel;
    }
}
