package com.example.schedulerservice.jobs;

public class InvalidScheduleException extends JobException {
    public InvalidScheduleException(String expression, Throwable cause) {
        super("invalid_schedule", "invalid cron \"" + expression + "\": "
                + (cause == null ? "no future execution time" : cause.getMessage()), cause);
    }
}
