package com.example.schedulerservice.messaging;

import com.example.schedulerservice.api.JobNameRequest;
import com.example.schedulerservice.jobs.Job;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ControlMessageDecoder {
    private final ObjectMapper mapper;

    public ControlMessageDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ControlCommand decode(String raw) throws ControlMessageException {
        if (raw == null || raw.isBlank()) {
            throw new ControlMessageException("empty message");
        }
        ControlMessage envelope;
        try {
            envelope = mapper.readValue(raw, ControlMessage.class);
        } catch (JsonProcessingException e) {
            throw new ControlMessageException("invalid message JSON: " + e.getOriginalMessage(), e);
        }
        if (envelope == null) {
            throw new ControlMessageException("empty message");
        }
        ControlMessageType type = ControlMessageType.fromWire(envelope.getType())
                .orElseThrow(() -> new ControlMessageException("unknown message type: " + envelope.getType()));
        if (envelope.getPayload() == null || !envelope.getPayload().isObject()) {
            throw new ControlMessageException(type + " message without an object payload");
        }
        try {
            switch (type) {
                case REGISTER:
                    Job job = mapper.treeToValue(envelope.getPayload(), Job.class);
                    if (job.getName() == null || job.getName().isBlank()) {
                        throw new ControlMessageException("REGISTER payload without a job name");
                    }
                    return ControlCommand.register(job);
                case DEREGISTER:
                    JobNameRequest req = mapper.treeToValue(envelope.getPayload(), JobNameRequest.class);
                    if (req.getName() == null || req.getName().isBlank()) {
                        throw new ControlMessageException("DEREGISTER payload without a job name");
                    }
                    return ControlCommand.deregister(req.getName());
                default:
                    throw new ControlMessageException("unhandled message type: " + type);
            }
        } catch (JsonProcessingException e) {
            throw new ControlMessageException("invalid " + type + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
