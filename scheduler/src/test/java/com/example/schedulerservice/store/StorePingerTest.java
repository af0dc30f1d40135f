package com.example.schedulerservice.store;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class StorePingerTest {

    @Test
    public void ping_reports_store_health_without_throwing() {
        HikariDataSource ds = TestDataSources.h2();
        JdbcJobStore store = new JdbcJobStore(ds);
        try (StorePinger pinger = new StorePinger(store)) {
            assertThat(pinger.pingOnce(), is(true));
            ds.close();
            assertThat(pinger.pingOnce(), is(false));
        }
    }
}
