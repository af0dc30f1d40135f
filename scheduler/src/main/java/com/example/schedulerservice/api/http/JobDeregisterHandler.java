package com.example.schedulerservice.api.http;

import com.example.schedulerservice.api.JobNameRequest;
import com.example.schedulerservice.jobs.JobException;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.store.StoreException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Success is a bodiless 204.
 */
@Slf4j
class JobDeregisterHandler implements HttpHandler {
    private final JobManager jobManager;
    private final HttpResponder responder;

    JobDeregisterHandler(JobManager jobManager, HttpResponder responder) {
        this.jobManager = jobManager;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!responder.requireExactPath(exchange) || !responder.requireMethod(exchange, "POST")) {
            return;
        }
        JobNameRequest req;
        try (InputStream is = exchange.getRequestBody()) {
            req = responder.getMapper().readValue(is, JobNameRequest.class);
        } catch (IOException e) {
            responder.respondError(exchange, 400, "bad_request", "invalid request body");
            return;
        }
        if (req == null || req.getName() == null || req.getName().isBlank()) {
            responder.respondError(exchange, 400, "bad_request", "job name is required");
            return;
        }
        try {
            jobManager.deregister(req.getName());
            responder.respondNoContent(exchange);
        } catch (JobException e) {
            responder.respondError(exchange, 400, e.getErrorCode(), e.getMessage());
        } catch (StoreException e) {
            log.error("Deregister of {} failed in store", req.getName(), e);
            responder.respondError(exchange, 500, "store_error", e.getMessage());
        }
    }
}
