package com.example.schedulerservice.jobs;

public class DuplicateJobException extends JobException {
    public DuplicateJobException(String name) {
        super("duplicate_job", "job \"" + name + "\" already exists");
    }
}
