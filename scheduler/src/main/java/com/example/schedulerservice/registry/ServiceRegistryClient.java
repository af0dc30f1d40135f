package com.example.schedulerservice.registry;

import com.example.schedulerservice.auth.ApiKeys;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Announces this instance to the external service registry. Registration
 * retries transport failures; deregistration is attempted once.
 */
@Slf4j
public class ServiceRegistryClient {
    public static final int REGISTER_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String registryUrl;
    private final String apiKey;
    private final ServiceDescriptor descriptor;
    private final Duration retryDelay;

    public ServiceRegistryClient(HttpClient client, ObjectMapper mapper, String registryUrl, String apiKey,
                                 ServiceDescriptor descriptor, Duration retryDelay) {
        this.client = client;
        this.mapper = mapper;
        this.registryUrl = registryUrl.endsWith("/")
                ? registryUrl.substring(0, registryUrl.length() - 1) : registryUrl;
        this.apiKey = apiKey;
        this.descriptor = descriptor;
        this.retryDelay = retryDelay;
    }

    public ServiceRegistryClient(ObjectMapper mapper, String registryUrl, String apiKey,
                                 ServiceDescriptor descriptor) {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), mapper, registryUrl, apiKey,
                descriptor, DEFAULT_RETRY_DELAY);
    }

    /** Registers on a daemon thread so startup does not wait on the registry. */
    public Thread registerInBackground() {
        Thread t = new Thread(this::register, "registry-register");
        t.setDaemon(true);
        t.start();
        return t;
    }

    /**
     * @return true once the registry accepted the registration
     */
    public boolean register() {
        int retries = REGISTER_RETRIES;
        while (true) {
            try {
                return accepted("register", post("/register"));
            } catch (IOException e) {
                if (retries == 0) {
                    log.error("Failed to register service with {}: {}", registryUrl, e.getMessage());
                    return false;
                }
                log.warn("Failed to register service, retrying... ({} retries left)", retries);
                retries--;
                if (!pause()) {
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public boolean deregister() {
        try {
            return accepted("deregister", post("/deregister"));
        } catch (IOException e) {
            log.error("Error deregistering service: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private int post(String path) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(registryUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(descriptor)));
        ApiKeys.attach(builder, apiKey);
        return client.send(builder.build(), HttpResponse.BodyHandlers.discarding()).statusCode();
    }

    private boolean accepted(String action, int status) {
        if (status >= 200 && status < 300) {
            log.info("Service {} {}ed with registry ({})", descriptor.getName(), action, status);
            return true;
        }
        log.warn("Registry rejected {} of {} with status {}", action, descriptor.getName(), status);
        return false;
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
