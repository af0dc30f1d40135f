package com.example.schedulerservice.messaging;

public class ControlMessageException extends Exception {
    public ControlMessageException(String message) {
        super(message);
    }

    public ControlMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
