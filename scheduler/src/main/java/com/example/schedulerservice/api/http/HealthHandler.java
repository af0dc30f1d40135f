package com.example.schedulerservice.api.http;

import com.example.schedulerservice.api.HealthResponse;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;

class HealthHandler implements HttpHandler {
    private final String serviceName;
    private final HttpResponder responder;

    HealthHandler(String serviceName, HttpResponder responder) {
        this.serviceName = serviceName;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!responder.requireExactPath(exchange) || !responder.requireMethod(exchange, "GET")) {
            return;
        }
        responder.respondJson(exchange, 200, new HealthResponse("ok", serviceName));
    }
}
