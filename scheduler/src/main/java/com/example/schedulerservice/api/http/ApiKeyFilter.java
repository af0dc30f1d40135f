package com.example.schedulerservice.api.http;

import com.example.schedulerservice.auth.ApiKeys;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Rejects requests whose X-API-Key header does not match the configured secret.
 */
@Slf4j
public class ApiKeyFilter extends Filter {
    private final String apiKey;
    private final HttpResponder responder;

    public ApiKeyFilter(String apiKey, HttpResponder responder) {
        this.apiKey = apiKey;
        this.responder = responder;
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (!ApiKeys.matches(apiKey, exchange.getRequestHeaders().getFirst(ApiKeys.HEADER))) {
            log.warn("Unauthorized request to {} from {}", exchange.getRequestURI().getPath(),
                    exchange.getRemoteAddress());
            responder.respondError(exchange, 401, "unauthorized", "missing or invalid " + ApiKeys.HEADER);
            return;
        }
        chain.doFilter(exchange);
    }

    @Override
    public String description() {
        return "API key check";
    }
}
