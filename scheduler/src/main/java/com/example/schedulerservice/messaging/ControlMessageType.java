package com.example.schedulerservice.messaging;

import java.util.Locale;
import java.util.Optional;

public enum ControlMessageType {
    REGISTER,
    DEREGISTER;

    /** Accepts the older {@code UNREGISTER} spelling as {@link #DEREGISTER}. */
    public static Optional<ControlMessageType> fromWire(String type) {
        if (type == null) {
            return Optional.empty();
        }
        switch (type.trim().toUpperCase(Locale.ROOT)) {
            case "REGISTER":
                return Optional.of(REGISTER);
            case "DEREGISTER":
            case "UNREGISTER":
                return Optional.of(DEREGISTER);
            default:
                return Optional.empty();
        }
    }
}
