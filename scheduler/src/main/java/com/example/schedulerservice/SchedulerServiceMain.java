package com.example.schedulerservice;

import com.example.schedulerservice.config.SchedulerConfig;
import com.example.schedulerservice.store.DataSources;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.hotspot.DefaultExports;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SchedulerServiceMain {

    public static void main(String[] args) {
        try {
            SchedulerConfig config = SchedulerConfig.fromEnvironment();

            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

            CollectorRegistry registry = CollectorRegistry.defaultRegistry;
            DefaultExports.register(registry);

            HikariDataSource ds = DataSources.create(config);
            SchedulerService service = new SchedulerService(config, ds, registry, mapper);
            Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "shutdown"));
            service.start();
        } catch (Exception e) {
            log.error("Scheduler service failed to start", e);
            System.exit(1);
        }
    }
}
