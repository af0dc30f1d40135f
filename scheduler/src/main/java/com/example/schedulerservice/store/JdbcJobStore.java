package com.example.schedulerservice.store;

import com.example.schedulerservice.jobs.DuplicateJobException;
import com.example.schedulerservice.jobs.Job;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link JobStore} over plain JDBC. The metric upsert is written as
 * update-then-insert so it runs unchanged on PostgreSQL and H2.
 */
@Slf4j
public class JdbcJobStore implements JobStore {
    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource ds;

    public JdbcJobStore(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public List<Job> loadJobs() {
        List<Job> jobs = new ArrayList<>();
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT name, cron, endpoint FROM jobs");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(new Job(rs.getString(1), rs.getString(2), rs.getString(3)));
            }
            return jobs;
        } catch (SQLException e) {
            throw new StoreException("failed to load jobs", e);
        }
    }

    @Override
    public void insertJob(Job job) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO jobs (name, cron, endpoint) VALUES (?, ?, ?)")) {
            ps.setString(1, job.getName());
            ps.setString(2, job.getCron());
            ps.setString(3, job.getEndpoint());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateJobException(job.getName());
            }
            throw new StoreException("failed to save job \"" + job.getName() + "\" in database", e);
        }
    }

    @Override
    public boolean deleteJob(String name) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE name = ?")) {
            ps.setString(1, name);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("failed to delete job \"" + name + "\" from database", e);
        }
    }

    @Override
    public List<MetricRow> loadMetrics() {
        List<MetricRow> rows = new ArrayList<>();
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT metric_name, job_name, metric_value FROM metrics");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                rows.add(new MetricRow(rs.getString(1), rs.getString(2), rs.getDouble(3)));
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("failed to load metrics", e);
        }
    }

    @Override
    public void addToMetric(String metricName, String jobName, double delta) {
        String job = jobName == null ? "" : jobName;
        try (Connection c = ds.getConnection()) {
            if (update(c, metricName, job, delta)) {
                return;
            }
            try {
                insert(c, metricName, job, delta);
            } catch (SQLException e) {
                // another writer created the row first
                if (UNIQUE_VIOLATION.equals(e.getSQLState()) && update(c, metricName, job, delta)) {
                    return;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("failed to update metric " + metricName, e);
        }
    }

    @Override
    public void ping() {
        try (Connection c = ds.getConnection()) {
            if (!c.isValid(5)) {
                throw new StoreException("database connection is not valid");
            }
        } catch (SQLException e) {
            throw new StoreException("database ping failed", e);
        }
    }

    @Override
    public void close() {
        if (ds instanceof Closeable) {
            try {
                ((Closeable) ds).close();
            } catch (IOException e) {
                throw new StoreException("failed to close database connection", e);
            }
        }
    }

    private static boolean update(Connection c, String metricName, String jobName, double delta) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE metrics SET metric_value = metric_value + ?, recorded_at = CURRENT_TIMESTAMP "
                        + "WHERE metric_name = ? AND job_name = ?")) {
            ps.setDouble(1, delta);
            ps.setString(2, metricName);
            ps.setString(3, jobName);
            return ps.executeUpdate() > 0;
        }
    }

    private static void insert(Connection c, String metricName, String jobName, double delta) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO metrics (metric_name, job_name, metric_value, recorded_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)")) {
            ps.setString(1, metricName);
            ps.setString(2, jobName);
            ps.setDouble(3, delta);
            ps.executeUpdate();
        }
    }
}
