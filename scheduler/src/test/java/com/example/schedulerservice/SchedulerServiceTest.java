package com.example.schedulerservice;

import com.example.schedulerservice.config.SchedulerConfig;
import com.example.schedulerservice.store.StoreException;
import com.example.schedulerservice.store.TestDataSources;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import org.junit.After;
import org.junit.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class SchedulerServiceTest {
    private static final Map<String, String> ENV = Map.of(
            "SCHEDULER_HTTP_PORT", "0",
            "GLOBAL_API_KEY", "k",
            "SCHEDULER_THREADS", "2",
            "SCHEDULER_SHUTDOWN_GRACE_SECONDS", "1");

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final List<SchedulerService> services = new ArrayList<>();

    @After
    public void teardown() {
        services.forEach(SchedulerService::stop);
    }

    @Test
    public void jobs_survive_a_restart() throws Exception {
        String db = "svc-" + UUID.randomUUID();
        SchedulerService first = start(ENV, TestDataSources.h2(db));
        HttpResponse<String> created = post(first, "/jobs/register",
                "{\"name\":\"daily\",\"cron\":\"0 0 * * *\",\"endpoint\":\"http://x/y\"}");
        assertThat(created.statusCode(), is(201));
        first.stop();
        first.stop();

        SchedulerService second = start(ENV, TestDataSources.h2(db));

        assertThat(second.getJobManager().contains("daily"), is(true));
        HttpResponse<String> list = client.send(HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + second.getHttpPort() + "/jobs/list"))
                .header("X-API-Key", "k")
                .GET().build(), HttpResponse.BodyHandlers.ofString());
        JsonNode jobs = mapper.readTree(list.body()).get("jobs");
        assertThat(jobs.size(), is(1));
        assertThat(jobs.get(0).get("name").asText(), is("daily"));
    }

    @Test
    public void unreadable_schema_descriptor_aborts_startup() {
        Map<String, String> env = new HashMap<>(ENV);
        env.put("DB_TABLES_PATH", "/does/not/exist/db-tables.json");
        SchedulerService service = new SchedulerService(SchedulerConfig.fromEnv(env), TestDataSources.h2(),
                new CollectorRegistry(), mapper);
        services.add(service);

        assertThrows(StoreException.class, service::start);
        assertThat(service.getHttpPort(), is(-1));
    }

    private SchedulerService start(Map<String, String> env, HikariDataSource ds) throws Exception {
        SchedulerService service = new SchedulerService(SchedulerConfig.fromEnv(env), ds, new CollectorRegistry(), mapper);
        services.add(service);
        service.start();
        return service;
    }

    private HttpResponse<String> post(SchedulerService service, String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + service.getHttpPort() + path))
                .header("X-API-Key", "k")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }
}
