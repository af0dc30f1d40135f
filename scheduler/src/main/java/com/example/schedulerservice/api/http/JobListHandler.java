package com.example.schedulerservice.api.http;

import com.example.schedulerservice.api.JobListResponse;
import com.example.schedulerservice.jobs.JobManager;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import java.io.IOException;

class JobListHandler implements HttpHandler {
    private final JobManager jobManager;
    private final HttpResponder responder;

    JobListHandler(JobManager jobManager, HttpResponder responder) {
        this.jobManager = jobManager;
        this.responder = responder;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        if (!responder.requireExactPath(exchange) || !responder.requireMethod(exchange, "GET")) {
            return;
        }
        responder.respondJson(exchange, 200,
                new JobListResponse("success", "job list retrieved successfully", jobManager.list()));
    }
}
