package com.example.schedulerservice.auth;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * The shared-secret header used both on inbound control requests and on
 * outbound calls made by the service.
 */
public final class ApiKeys {
    public static final String HEADER = "X-API-Key";

    private ApiKeys() {
    }

    public static boolean isConfigured(String apiKey) {
        return apiKey != null && !apiKey.isEmpty();
    }

    /** Adds the header when a key is configured. */
    public static HttpRequest.Builder attach(HttpRequest.Builder builder, String apiKey) {
        if (isConfigured(apiKey)) {
            builder.header(HEADER, apiKey);
        }
        return builder;
    }

    public static boolean matches(String expected, String presented) {
        if (!isConfigured(expected)) {
            return true;
        }
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
