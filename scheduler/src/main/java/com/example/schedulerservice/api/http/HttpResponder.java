package com.example.schedulerservice.api.http;

import com.example.schedulerservice.api.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes JSON responses and counts them per route, method and status.
 */
public class HttpResponder {
    private final ObjectMapper mapper;
    private final Counter httpRequestsTotal;

    public HttpResponder(ObjectMapper mapper, CollectorRegistry registry) {
        this.mapper = mapper;
        this.httpRequestsTotal = Counter.build()
                .name("scheduler_http_requests_total")
                .help("Scheduler HTTP requests")
                .labelNames("path", "method", "status")
                .register(registry);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public void respondJson(HttpExchange exchange, int code, Object value) throws IOException {
        byte[] data = mapper.writeValueAsBytes(value);
        count(exchange, code);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    public void respondError(HttpExchange exchange, int code, String status, String message) throws IOException {
        respondJson(exchange, code, new ErrorResponse(status, message));
    }

    public void respondNoContent(HttpExchange exchange) throws IOException {
        count(exchange, 204);
        exchange.sendResponseHeaders(204, -1);
        exchange.close();
    }

    public void respondRaw(HttpExchange exchange, int code, String contentType, byte[] data) throws IOException {
        count(exchange, code);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, data.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(data);
        }
    }

    /**
     * Contexts match by prefix; answers 404 and returns false for anything below
     * the registered path.
     */
    public boolean requireExactPath(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String contextPath = exchange.getHttpContext().getPath();
        if (path.equals(contextPath) || path.equals(contextPath + "/")) {
            return true;
        }
        respondError(exchange, 404, "not_found", "no route for " + path);
        return false;
    }

    public boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        respondError(exchange, 405, "method_not_allowed", exchange.getRequestMethod());
        return false;
    }

    private void count(HttpExchange exchange, int code) {
        httpRequestsTotal.labels(exchange.getHttpContext().getPath(), exchange.getRequestMethod(),
                String.valueOf(code)).inc();
    }
}
