package com.example.schedulerservice.messaging;

import com.example.schedulerservice.jobs.JobExecutor;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.metrics.DurableMetricsMirror;
import com.example.schedulerservice.metrics.JobMetrics;
import com.example.schedulerservice.metrics.SchedulerMetrics;
import com.example.schedulerservice.schedule.ManualScheduler;
import com.example.schedulerservice.store.FailingJobStore;
import com.example.schedulerservice.store.JdbcJobStore;
import com.example.schedulerservice.store.TestDataSources;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ControlMessageHandlerTest {
    static final String REGISTER_PING = "{\"type\":\"REGISTER\",\"payload\":"
            + "{\"name\":\"ping\",\"cron\":\"* * * * *\",\"endpoint\":\"http://x/ping\"}}";
    static final String DEREGISTER_PING = "{\"type\":\"DEREGISTER\",\"payload\":{\"name\":\"ping\"}}";

    private HikariDataSource ds;
    private FailingJobStore store;
    private DurableMetricsMirror mirror;
    private ManualScheduler scheduler;
    private JobManager jobManager;
    private ControlMessageHandler handler;

    @Before
    public void setup() {
        ds = TestDataSources.h2();
        store = new FailingJobStore(new JdbcJobStore(ds));
        mirror = new DurableMetricsMirror(store);
        JobMetrics metrics = new JobMetrics(new SchedulerMetrics(new CollectorRegistry()), mirror);
        scheduler = new ManualScheduler();
        jobManager = new JobManager(scheduler, store, metrics, new JobExecutor(Duration.ofSeconds(1), "", metrics));
        jobManager.start();
        handler = new ControlMessageHandler(new ControlMessageDecoder(new ObjectMapper()), jobManager);
    }

    @After
    public void teardown() {
        mirror.close();
        ds.close();
    }

    @Test
    public void register_and_deregister_through_the_queue() {
        assertThat(handler.handle(REGISTER_PING), is(true));
        assertThat(jobManager.contains("ping"), is(true));

        assertThat(handler.handle(DEREGISTER_PING), is(true));
        assertThat(jobManager.contains("ping"), is(false));
    }

    @Test
    public void duplicate_register_is_a_logged_rejection() {
        handler.handle(REGISTER_PING);

        assertThat(handler.handle(REGISTER_PING), is(false));

        assertThat(jobManager.size(), is(1));
        assertThat(scheduler.size(), is(1));
    }

    @Test
    public void bad_messages_never_escape_the_handler() {
        assertThat(handler.handle("{garbage"), is(false));
        assertThat(handler.handle("{\"type\":\"PAUSE\",\"payload\":{}}"), is(false));
        assertThat(handler.handle(DEREGISTER_PING), is(false));
        assertThat(handler.handle("{\"type\":\"REGISTER\",\"payload\":"
                + "{\"name\":\"bad\",\"cron\":\"not-a-cron\",\"endpoint\":\"http://x/bad\"}}"), is(false));

        store.setFailInsert(true);
        assertThat(handler.handle(REGISTER_PING), is(false));
        assertThat(jobManager.size(), is(0));
    }

    @Test
    public void unexpected_failures_are_contained() {
        jobManager.shutdown(Duration.ZERO);

        assertThat(handler.handle(REGISTER_PING), is(false));
        assertThat(jobManager.size(), is(0));
        assertThat(store.loadJobs().isEmpty(), is(true));
    }
}
