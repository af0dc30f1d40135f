package com.example.schedulerservice.jobs;

public class InvalidJobException extends JobException {
    public InvalidJobException(String message) {
        super("invalid_job", message);
    }
}
