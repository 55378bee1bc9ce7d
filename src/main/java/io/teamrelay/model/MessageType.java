package io.teamrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    DIRECT("direct"),
    BROADCAST("broadcast"),
    SHUTDOWN_REQUEST("shutdown_request"),
    SHUTDOWN_RESPONSE("shutdown_response"),
    PLAN_APPROVAL_RESPONSE("plan_approval_response");

    private final String wire;

    MessageType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DIRECT;
        }
        for (MessageType value : values()) {
            if (value.wire.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        if ("message".equalsIgnoreCase(raw)) {
            return DIRECT;
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
