package com.example.schedulerservice.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

/**
 * Process configuration read once from the environment.
 */
public final class SchedulerConfig {
    private final String serviceName;
    private final int httpPort;
    private final String apiKey;
    private final String jdbcUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int dbPoolSize;
    private final String dbTablesPath;
    private final Duration dbPingInterval;
    private final Duration jobHttpTimeout;
    private final int schedulerThreads;
    private final ZoneId timezone;
    private final Duration shutdownGrace;
    private final KafkaSettings kafka;
    private final String serviceRegistryUrl;
    private final String serviceUrl;

    private SchedulerConfig(Map<String, String> env) {
        this.serviceName = env(env, "SERVICE_NAME", "schedulerservice");
        this.httpPort = intEnv(env, "SCHEDULER_HTTP_PORT", 8080);
        this.apiKey = env(env, "GLOBAL_API_KEY", "");

        String host = env(env, "PG_HOST", "localhost");
        int port = intEnv(env, "PG_PORT", 5432);
        String db = env(env, "PG_DB", "scheduler");
        this.jdbcUrl = env(env, "DB_JDBC_URL", "jdbc:postgresql://" + host + ":" + port + "/" + db);
        this.dbUser = env(env, "PG_USER", "app");
        this.dbPassword = env(env, "PG_PASSWORD", "app");
        this.dbPoolSize = intEnv(env, "DB_POOL_SIZE", 10);
        this.dbTablesPath = blankToNull(env.get("DB_TABLES_PATH"));
        this.dbPingInterval = Duration.ofSeconds(intEnv(env, "DB_PING_INTERVAL_SECONDS", 300));

        this.jobHttpTimeout = Duration.ofSeconds(intEnv(env, "JOB_HTTP_TIMEOUT_SECONDS", 30));
        this.schedulerThreads = intEnv(env, "SCHEDULER_THREADS", 2);
        this.timezone = zoneEnv(env, "SCHEDULER_TIMEZONE", "UTC");
        this.shutdownGrace = Duration.ofSeconds(intEnv(env, "SCHEDULER_SHUTDOWN_GRACE_SECONDS", 30));

        String brokers = blankToNull(env.get("KAFKA_BROKERS"));
        String topic = blankToNull(env.get("KAFKA_TOPIC"));
        String groupId = blankToNull(env.get("KAFKA_GROUP_ID"));
        this.kafka = (brokers == null || topic == null || groupId == null)
                ? null : new KafkaSettings(brokers, topic, groupId);

        this.serviceRegistryUrl = blankToNull(env.get("SERVICE_REGISTRY_URL"));
        this.serviceUrl = env(env, "SERVICE_URL", serviceName + ":" + httpPort);
    }

    public static SchedulerConfig fromEnvironment() {
        return fromEnv(System.getenv());
    }

    public static SchedulerConfig fromEnv(Map<String, String> env) {
        return new SchedulerConfig(env);
    }

    public String getServiceName() {
        return serviceName;
    }

    public int getHttpPort() {
        return httpPort;
    }

    /** Shared secret for the X-API-Key header, empty when not configured. */
    public String getApiKey() {
        return apiKey;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public int getDbPoolSize() {
        return dbPoolSize;
    }

    public Optional<String> getDbTablesPath() {
        return Optional.ofNullable(dbTablesPath);
    }

    public Duration getDbPingInterval() {
        return dbPingInterval;
    }

    public Duration getJobHttpTimeout() {
        return jobHttpTimeout;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ZoneId getTimezone() {
        return timezone;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    /** Present only when brokers, topic and group id are all set. */
    public Optional<KafkaSettings> getKafka() {
        return Optional.ofNullable(kafka);
    }

    public Optional<String> getServiceRegistryUrl() {
        return Optional.ofNullable(serviceRegistryUrl);
    }

    public String getServiceUrl() {
        return serviceUrl;
    }

    private static String env(Map<String, String> env, String k, String d) {
        String v = env.get(k);
        return v == null ? d : v;
    }

    private static int intEnv(Map<String, String> env, String k, int d) {
        String v = env.get(k);
        if (v == null || v.isBlank()) {
            return d;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(k + " must be an integer, got: " + v, e);
        }
    }

    private static ZoneId zoneEnv(Map<String, String> env, String k, String d) {
        String v = env(env, k, d).trim();
        try {
            return ZoneId.of(v.isEmpty() ? d : v);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(k + " must be a zone id, got: " + v, e);
        }
    }

    private static String blankToNull(String v) {
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    public static final class KafkaSettings {
        private final String brokers;
        private final String topic;
        private final String groupId;

        KafkaSettings(String brokers, String topic, String groupId) {
            this.brokers = brokers;
            this.topic = topic;
            this.groupId = groupId;
        }

        public String getBrokers() {
            return brokers;
        }

        public String getTopic() {
            return topic;
        }

        public String getGroupId() {
            return groupId;
        }
    }
}
