package io.teamrelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberStatus {
    ALIVE("alive"),
    DEAD("dead"),
    UNKNOWN("unknown");

    private final String wire;

    MemberStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
