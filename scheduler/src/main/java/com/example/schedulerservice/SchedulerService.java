package com.example.schedulerservice;

import com.example.schedulerservice.api.http.HttpApi;
import com.example.schedulerservice.config.SchedulerConfig;
import com.example.schedulerservice.jobs.JobExecutor;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.messaging.ControlMessageDecoder;
import com.example.schedulerservice.messaging.ControlMessageHandler;
import com.example.schedulerservice.messaging.ControlPlaneConsumer;
import com.example.schedulerservice.metrics.DurableMetricsMirror;
import com.example.schedulerservice.metrics.JobMetrics;
import com.example.schedulerservice.metrics.SchedulerMetrics;
import com.example.schedulerservice.registry.ServiceDescriptor;
import com.example.schedulerservice.registry.ServiceRegistryClient;
import com.example.schedulerservice.schedule.CronUtilsScheduler;
import com.example.schedulerservice.store.JdbcJobStore;
import com.example.schedulerservice.store.SchemaDescriptor;
import com.example.schedulerservice.store.SchemaInitializer;
import com.example.schedulerservice.store.StoreException;
import com.example.schedulerservice.store.StorePinger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every long-lived component and starts and stops them in order.
 * <p>
 * Startup: schema, store, metric reconciliation, job recovery, HTTP, queue
 * consumer, store pinger, registry. Shutdown stops intake first, lets running
 * ticks finish, drains the metric mirror and only then closes the store.
 */
@Slf4j
public class SchedulerService {
    private final SchedulerConfig config;
    private final DataSource dataSource;
    private final CollectorRegistry registry;
    private final ObjectMapper mapper;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private JdbcJobStore store;
    private DurableMetricsMirror mirror;
    private CronUtilsScheduler scheduler;
    private JobManager jobManager;
    private HttpServer server;
    private ControlPlaneConsumer consumer;
    private StorePinger pinger;
    private ServiceRegistryClient registryClient;

    public SchedulerService(SchedulerConfig config, DataSource dataSource, CollectorRegistry registry,
                            ObjectMapper mapper) {
        this.config = config;
        this.dataSource = dataSource;
        this.registry = registry;
        this.mapper = mapper;
    }

    /**
     * @throws StoreException if the schema or the persisted state cannot be read;
     *         nothing is serving at that point
     * @throws IOException if the HTTP port cannot be bound
     */
    public void start() throws IOException {
        SchemaInitializer schema = new SchemaInitializer(mapper);
        SchemaDescriptor descriptor = config.getDbTablesPath()
                .map(p -> schema.loadFromFile(Path.of(p)))
                .orElseGet(() -> schema.loadFromClasspath(SchemaInitializer.DEFAULT_RESOURCE));
        schema.apply(dataSource, descriptor);

        store = new JdbcJobStore(dataSource);
        mirror = new DurableMetricsMirror(store);
        SchedulerMetrics metrics = new SchedulerMetrics(registry);
        JobMetrics jobMetrics = new JobMetrics(metrics, mirror);
        scheduler = new CronUtilsScheduler(config.getSchedulerThreads(), config.getTimezone());
        JobExecutor executor = new JobExecutor(config.getJobHttpTimeout(), config.getApiKey(), jobMetrics);
        jobManager = new JobManager(scheduler, store, jobMetrics, executor);
        jobManager.start();

        server = HttpApi.start(config.getHttpPort(), jobManager, metrics, config.getApiKey(),
                config.getServiceName(), mapper);

        ControlMessageHandler handler = new ControlMessageHandler(new ControlMessageDecoder(mapper), jobManager);
        config.getKafka().ifPresentOrElse(kafka -> {
            consumer = ControlPlaneConsumer.create(kafka, handler);
            consumer.start();
        }, () -> log.info("Kafka not configured; queue control plane disabled"));

        pinger = new StorePinger(store);
        pinger.start(config.getDbPingInterval());

        config.getServiceRegistryUrl().ifPresentOrElse(url -> {
            String serviceUrl = config.getServiceUrl();
            registryClient = new ServiceRegistryClient(mapper, url, config.getApiKey(),
                    new ServiceDescriptor(config.getServiceName(), serviceUrl, serviceUrl + "/healthz"));
            registryClient.registerInBackground();
        }, () -> log.info("SERVICE_REGISTRY_URL not set; skipping self-registration"));

        log.info("{} started on port {} with {} jobs", config.getServiceName(), getHttpPort(), jobManager.size());
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down {}", config.getServiceName());
        if (server != null) {
            server.stop(1);
            Executor httpExecutor = server.getExecutor();
            if (httpExecutor instanceof ExecutorService) {
                ((ExecutorService) httpExecutor).shutdown();
            }
        }
        if (consumer != null) {
            consumer.close();
        }
        if (jobManager != null) {
            jobManager.shutdown(config.getShutdownGrace());
        } else if (scheduler != null) {
            scheduler.shutdown(config.getShutdownGrace());
        }
        if (mirror != null) {
            mirror.close();
        }
        if (pinger != null) {
            pinger.close();
        }
        if (store != null) {
            try {
                store.close();
            } catch (StoreException e) {
                log.error("Error closing database connection: {}", e.getMessage());
            }
        }
        if (registryClient != null) {
            registryClient.deregister();
        }
        log.info("Shutdown complete");
    }

    public int getHttpPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    public JobManager getJobManager() {
        return jobManager;
    }
}
