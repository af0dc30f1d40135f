package com.example.schedulerservice.messaging;

import com.example.schedulerservice.jobs.JobException;
import com.example.schedulerservice.jobs.JobManager;
import com.example.schedulerservice.store.StoreException;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies queue messages to the job manager. There is no caller to answer, so
 * every rejection ends as a log line.
 */
@Slf4j
public class ControlMessageHandler {
    private final ControlMessageDecoder decoder;
    private final JobManager jobManager;

    public ControlMessageHandler(ControlMessageDecoder decoder, JobManager jobManager) {
        this.decoder = decoder;
        this.jobManager = jobManager;
    }

    /** @return true when the message changed the job set */
    public boolean handle(String raw) {
        ControlCommand command;
        try {
            command = decoder.decode(raw);
        } catch (ControlMessageException e) {
            log.warn("Dropping control message: {}", e.getMessage());
            return false;
        }
        try {
            switch (command.getType()) {
                case REGISTER:
                    jobManager.register(command.getJob());
                    return true;
                case DEREGISTER:
                    jobManager.deregister(command.getName());
                    return true;
                default:
                    log.warn("Unhandled control message {}", command);
                    return false;
            }
        } catch (JobException e) {
            log.warn("Rejected {} from queue: {}", command, e.getMessage());
        } catch (StoreException e) {
            log.error("Store failure applying {} from queue", command, e);
        } catch (RuntimeException e) {
            log.error("Failed to apply {} from queue", command, e);
        }
        return false;
    }
}
