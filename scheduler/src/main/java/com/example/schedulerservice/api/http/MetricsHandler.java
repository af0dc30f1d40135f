package com.example.schedulerservice.api.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

class MetricsHandler implements HttpHandler {
    private final CollectorRegistry registry;
    private final HttpResponder responder;

    MetricsHandler(CollectorRegistry registry, HttpResponder responder) {
        this.registry = registry;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!responder.requireExactPath(exchange)) {
            return;
        }
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        responder.respondRaw(exchange, 200, TextFormat.CONTENT_TYPE_004,
                writer.toString().getBytes(StandardCharsets.UTF_8));
    }
}
