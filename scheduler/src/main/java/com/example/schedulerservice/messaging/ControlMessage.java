package com.example.schedulerservice.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire envelope of a queue message: {@code {"type": "...", "payload": {...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlMessage {
    private String type;
    private JsonNode payload;

    public ControlMessage() {
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }
}
