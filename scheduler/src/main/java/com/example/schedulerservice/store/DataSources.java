package com.example.schedulerservice.store;

import com.example.schedulerservice.config.SchedulerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

public final class DataSources {
    private DataSources() {
    }

    public static HikariDataSource create(SchedulerConfig config) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(config.getJdbcUrl());
        hc.setUsername(config.getDbUser());
        hc.setPassword(config.getDbPassword());
        hc.setMaximumPoolSize(config.getDbPoolSize());
        hc.setPoolName("scheduler-db");
        return new HikariDataSource(hc);
    }
}
