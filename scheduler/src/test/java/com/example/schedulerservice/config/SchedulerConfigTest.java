package com.example.schedulerservice.config;

import org.junit.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class SchedulerConfigTest {

    @Test
    public void defaults() {
        SchedulerConfig c = SchedulerConfig.fromEnv(Map.of());

        assertThat(c.getServiceName(), is("schedulerservice"));
        assertThat(c.getHttpPort(), is(8080));
        assertThat(c.getApiKey(), is(""));
        assertThat(c.getJdbcUrl(), is("jdbc:postgresql://localhost:5432/scheduler"));
        assertThat(c.getDbUser(), is("app"));
        assertThat(c.getDbPoolSize(), is(10));
        assertThat(c.getDbTablesPath().isPresent(), is(false));
        assertThat(c.getDbPingInterval(), is(Duration.ofMinutes(5)));
        assertThat(c.getJobHttpTimeout(), is(Duration.ofSeconds(30)));
        assertThat(c.getSchedulerThreads(), is(2));
        assertThat(c.getTimezone(), is(ZoneId.of("UTC")));
        assertThat(c.getShutdownGrace(), is(Duration.ofSeconds(30)));
        assertThat(c.getKafka().isPresent(), is(false));
        assertThat(c.getServiceRegistryUrl().isPresent(), is(false));
        assertThat(c.getServiceUrl(), is("schedulerservice:8080"));
    }

    @Test
    public void overrides() {
        SchedulerConfig c = SchedulerConfig.fromEnv(Map.of(
                "SERVICE_NAME", "sched",
                "SCHEDULER_HTTP_PORT", "9090",
                "PG_HOST", "db",
                "PG_DB", "jobs",
                "SCHEDULER_TIMEZONE", "Europe/Berlin",
                "KAFKA_BROKERS", "k1:9092",
                "KAFKA_TOPIC", "scheduler-control",
                "KAFKA_GROUP_ID", "scheduler",
                "SERVICE_REGISTRY_URL", "http://registry:8500"));

        assertThat(c.getJdbcUrl(), is("jdbc:postgresql://db:5432/jobs"));
        assertThat(c.getTimezone(), is(ZoneId.of("Europe/Berlin")));
        assertThat(c.getKafka().get().getBrokers(), is("k1:9092"));
        assertThat(c.getKafka().get().getTopic(), is("scheduler-control"));
        assertThat(c.getKafka().get().getGroupId(), is("scheduler"));
        assertThat(c.getServiceRegistryUrl().get(), is("http://registry:8500"));
        assertThat(c.getServiceUrl(), is("sched:9090"));
    }

    @Test
    public void explicit_jdbc_url_wins() {
        SchedulerConfig c = SchedulerConfig.fromEnv(Map.of("DB_JDBC_URL", "jdbc:h2:mem:x", "PG_HOST", "ignored"));
        assertThat(c.getJdbcUrl(), is("jdbc:h2:mem:x"));
    }

    @Test
    public void partial_kafka_settings_disable_the_queue() {
        SchedulerConfig c = SchedulerConfig.fromEnv(Map.of("KAFKA_BROKERS", "k1:9092", "KAFKA_TOPIC", " "));
        assertThat(c.getKafka().isPresent(), is(false));
    }

    @Test
    public void bad_values_fail_fast() {
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("SCHEDULER_HTTP_PORT", "eighty")));
        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("SCHEDULER_TIMEZONE", "Mars/Olympus")));
    }
}
