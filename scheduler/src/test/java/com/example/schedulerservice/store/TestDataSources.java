package com.example.schedulerservice.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.UUID;

/**
 * In-memory H2 databases in PostgreSQL mode with the service schema applied.
 */
public final class TestDataSources {
    private TestDataSources() {
    }

    public static HikariDataSource h2() {
        return h2("sched-" + UUID.randomUUID());
    }

    /** Same name, same database: it outlives the pool until the JVM exits. */
    public static HikariDataSource h2(String dbName) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl("jdbc:h2:mem:" + dbName
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        hc.setUsername("sa");
        hc.setPassword("");
        hc.setMaximumPoolSize(4);
        HikariDataSource ds = new HikariDataSource(hc);
        SchemaInitializer schema = new SchemaInitializer(new ObjectMapper());
        schema.apply(ds, schema.loadFromClasspath(SchemaInitializer.DEFAULT_RESOURCE));
        return ds;
    }
}
