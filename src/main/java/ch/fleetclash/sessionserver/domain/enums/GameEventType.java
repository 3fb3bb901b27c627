package ch.fleetclash.sessionserver.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of events pushed to subscribers of a game.
 *
 * <p>Serialized in snake case (e.g. {@code player_joined}); the same name is used as SSE event name.
 */
public enum GameEventType {
    PLAYER_JOINED,
    SHIPS_PLACED,
    GAME_STARTED,
    ATTACK_MADE,
    TURN_TIMEOUT,
    GAME_FINISHED,
    GAME_ABANDONED,
    GAME_PAUSED,
    GAME_RESUMED,
    PLAYER_DISCONNECTED,
    PLAYER_RECONNECTED,
    RECONNECTION_AVAILABLE,
    CONNECTION_ESTABLISHED,
    HEARTBEAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
