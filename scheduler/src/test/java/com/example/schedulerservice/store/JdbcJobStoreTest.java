package com.example.schedulerservice.store;

import com.example.schedulerservice.jobs.DuplicateJobException;
import com.example.schedulerservice.jobs.Job;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class JdbcJobStoreTest {
    private HikariDataSource ds;
    private JdbcJobStore store;

    @Before
    public void setup() {
        ds = TestDataSources.h2();
        store = new JdbcJobStore(ds);
    }

    @After
    public void teardown() {
        ds.close();
    }

    @Test
    public void inserted_jobs_are_loaded_back() {
        store.insertJob(new Job("ping", "* * * * *", "http://x/ping"));
        store.insertJob(new Job("daily", "0 0 * * *", "http://x/y"));

        List<Job> jobs = store.loadJobs();
        assertThat(jobs.size(), is(2));
        assertThat(jobs.contains(new Job("daily", "0 0 * * *", "http://x/y")), is(true));
    }

    @Test
    public void second_insert_of_a_name_is_a_duplicate() {
        store.insertJob(new Job("ping", "* * * * *", "http://x/ping"));
        DuplicateJobException e = assertThrows(DuplicateJobException.class,
                () -> store.insertJob(new Job("ping", "*/5 * * * *", "http://x/other")));
        assertThat(e.getErrorCode(), is("duplicate_job"));
        assertThat(store.loadJobs().size(), is(1));
    }

    @Test
    public void delete_reports_whether_a_row_existed() {
        store.insertJob(new Job("ping", "* * * * *", "http://x/ping"));
        assertThat(store.deleteJob("ping"), is(true));
        assertThat(store.deleteJob("ping"), is(false));
        assertThat(store.loadJobs().isEmpty(), is(true));
    }

    @Test
    public void metric_updates_are_additive() {
        store.addToMetric("scheduler_job_executions_total", "ping", 1);
        store.addToMetric("scheduler_job_executions_total", "ping", 1);
        store.addToMetric("scheduler_job_executions_total", "other", 1);
        store.addToMetric("scheduler_jobs_active", "", 1);
        store.addToMetric("scheduler_jobs_active", null, -1);
        store.addToMetric("scheduler_jobs_active", "", 1);

        List<MetricRow> rows = store.loadMetrics();
        assertThat(rows.size(), is(3));
        MetricRow ping = find(rows, "scheduler_job_executions_total", "ping");
        assertThat(ping.getValue(), is(2.0));
        MetricRow active = find(rows, "scheduler_jobs_active", "");
        assertThat(active.isGlobal(), is(true));
        assertThat(active.getValue(), is(1.0));
    }

    @Test
    public void ping_fails_once_closed() {
        store.ping();
        store.close();
        assertThrows(StoreException.class, () -> store.ping());
    }

    private static MetricRow find(List<MetricRow> rows, String metric, String job) {
        List<MetricRow> matches = rows.stream()
                .filter(r -> r.getMetricName().equals(metric) && r.getJobName().equals(job))
                .collect(Collectors.toList());
        assertThat(matches.size(), is(1));
        return matches.get(0);
    }
}
