package com.example.schedulerservice.messaging;

import com.example.schedulerservice.jobs.Job;

/**
 * A decoded queue message. {@code job} is set for {@link ControlMessageType#REGISTER},
 * {@code name} for {@link ControlMessageType#DEREGISTER}.
 */
public final class ControlCommand {
    private final ControlMessageType type;
    private final Job job;
    private final String name;

    private ControlCommand(ControlMessageType type, Job job, String name) {
        this.type = type;
        this.job = job;
        this.name = name;
    }

    public static ControlCommand register(Job job) {
        return new ControlCommand(ControlMessageType.REGISTER, job, job.getName());
    }

    public static ControlCommand deregister(String name) {
        return new ControlCommand(ControlMessageType.DEREGISTER, null, name);
    }

    public ControlMessageType getType() {
        return type;
    }

    public Job getJob() {
        return job;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return type + "(" + name + ")";
    }
}
