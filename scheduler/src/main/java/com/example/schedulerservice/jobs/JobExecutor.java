package com.example.schedulerservice.jobs;

import com.example.schedulerservice.auth.ApiKeys;
import com.example.schedulerservice.metrics.JobMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Runs one tick of a job: a single GET to its endpoint, classified as success
 * (2xx) or failure (anything else, transport error, timeout) and recorded in
 * the metrics. Nothing is retried and nothing is thrown back at the scheduler.
 */
@Slf4j
public class JobExecutor {
    private final HttpClient client;
    private final Duration timeout;
    private final String apiKey;
    private final JobMetrics metrics;

    public JobExecutor(HttpClient client, Duration timeout, String apiKey, JobMetrics metrics) {
        this.client = client;
        this.timeout = timeout;
        this.apiKey = apiKey;
        this.metrics = metrics;
    }

    public JobExecutor(Duration timeout, String apiKey, JobMetrics metrics) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout, apiKey, metrics);
    }

    public ExecutionOutcome execute(Job job) {
        long start = System.nanoTime();
        log.info("Executing {} -> {}", job.getName(), job.getEndpoint());
        try {
            int status = trigger(job);
            if (status < 200 || status >= 300) {
                log.error("Job {} returned non-2xx status: {}", job.getName(), status);
                return failed(job);
            }
        } catch (HttpTimeoutException e) {
            log.error("Job {} timed out after {}s", job.getName(), timeout.toSeconds());
            return failed(job);
        } catch (IOException e) {
            log.error("Failed to execute job {}: {}", job.getName(), e.getMessage());
            return failed(job);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted", job.getName());
            return failed(job);
        } catch (RuntimeException e) {
            log.error("Failed to execute job {}", job.getName(), e);
            return failed(job);
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        try {
            metrics.executionSucceeded(job.getName(), seconds);
        } catch (RuntimeException e) {
            log.warn("Could not record success of job {}", job.getName(), e);
        }
        return ExecutionOutcome.SUCCESS;
    }

    private int trigger(Job job) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(job.getEndpoint()))
                .timeout(timeout)
                .GET();
        ApiKeys.attach(builder, apiKey);
        HttpResponse<Void> response = client.send(builder.build(), HttpResponse.BodyHandlers.discarding());
        return response.statusCode();
    }

    private ExecutionOutcome failed(Job job) {
        try {
            metrics.executionFailed(job.getName());
        } catch (RuntimeException e) {
            log.warn("Could not record failure of job {}", job.getName(), e);
        }
        return ExecutionOutcome.FAILURE;
    }
}
