package com.example.schedulerservice.api.http;

import com.example.schedulerservice.api.JobResponse;
import com.example.schedulerservice.jobs.Job;
import com.example.schedulerservice.jobs.JobException;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.store.StoreException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
class JobRegisterHandler implements HttpHandler {
    private final JobManager jobManager;
    private final HttpResponder responder;

    JobRegisterHandler(JobManager jobManager, HttpResponder responder) {
        this.jobManager = jobManager;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!responder.requireExactPath(exchange) || !responder.requireMethod(exchange, "POST")) {
            return;
        }
        Job job;
        try (InputStream is = exchange.getRequestBody()) {
            job = responder.getMapper().readValue(is, Job.class);
        } catch (IOException e) {
            responder.respondError(exchange, 400, "bad_request", "invalid request body");
            return;
        }
        if (job == null) {
            responder.respondError(exchange, 400, "bad_request", "invalid request body");
            return;
        }
        try {
            Job registered = jobManager.register(job);
            responder.respondJson(exchange, 201, new JobResponse("registered", registered.getName(),
                    "job registered successfully", registered));
        } catch (JobException e) {
            responder.respondError(exchange, 400, e.getErrorCode(), e.getMessage());
        } catch (StoreException e) {
            log.error("Register of {} failed in store", job.getName(), e);
            responder.respondError(exchange, 500, "store_error", e.getMessage());
        }
    }
}
