package ch.fleetclash.sessionserver.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PauseReason {
    DISCONNECT,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
