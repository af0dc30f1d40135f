package com.example.schedulerservice.api.http;

import com.example.schedulerservice.auth.ApiKeys;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.metrics.SchedulerMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;

/**
 * The synchronous control surface. {@code /healthz} and {@code /metrics} are open,
 * the {@code /jobs/*} routes need the API key.
 */
@Slf4j
public final class HttpApi {
    private HttpApi() {
    }

    // Exposed for tests: port 0 binds an ephemeral port
    public static HttpServer start(int port, JobManager jobManager, SchedulerMetrics metrics, String apiKey,
                                   String serviceName, ObjectMapper mapper) throws IOException {
        HttpResponder responder = new HttpResponder(mapper, metrics.getRegistry());
        ApiKeyFilter auth = new ApiKeyFilter(apiKey, responder);
        if (!ApiKeys.isConfigured(apiKey)) {
            log.warn("GLOBAL_API_KEY is not set; /jobs routes accept unauthenticated requests");
        }

        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", new HealthHandler(serviceName, responder));
        server.createContext("/metrics", new MetricsHandler(metrics.getRegistry(), responder));
        protect(server.createContext("/jobs/register", new JobRegisterHandler(jobManager, responder)), auth);
        protect(server.createContext("/jobs/deregister", new JobDeregisterHandler(jobManager, responder)), auth);
        protect(server.createContext("/jobs/list", new JobListHandler(jobManager, responder)), auth);
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
        log.info("HTTP server started on port {}", server.getAddress().getPort());
        return server;
    }

    private static void protect(HttpContext context, ApiKeyFilter filter) {
        context.getFilters().add(filter);
    }
}
