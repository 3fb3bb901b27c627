package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.Coordinate;
import ch.fleetclash.sessionserver.domain.DisconnectedSession;
import ch.fleetclash.sessionserver.domain.Game;
import ch.fleetclash.sessionserver.domain.PauseRecord;
import ch.fleetclash.sessionserver.domain.Player;
import ch.fleetclash.sessionserver.domain.PlayerConnection;
import ch.fleetclash.sessionserver.domain.Ship;
import ch.fleetclash.sessionserver.domain.enums.GameEventType;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import ch.fleetclash.sessionserver.domain.enums.ShotResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event pushed to game subscribers over SSE or STOMP.
 *
 * <p>{@code phase} is the game phase after the change, or {@code null} for events raised by the
 * connection layer, which does not look into the game.
 */
public record GameEventDto(
        GameEventType type,
        String gameId,
        GamePhase phase,
        Instant timestamp,
        Map<String, Object> payload
) {
    public static GameEventDto playerJoined(Game game, Player player, Instant now) {
        return of(GameEventType.PLAYER_JOINED, game, now, payload(
                "playerId", player.getId(),
                "playerName", player.getName(),
                "playerCount", game.getPlayers().size()));
    }

    public static GameEventDto shipsPlaced(Game game, Player player, boolean allPlayersReady, Instant now) {
        return of(GameEventType.SHIPS_PLACED, game, now, payload(
                "playerId", player.getId(),
                "playerName", player.getName(),
                "ready", player.isReady(),
                "allPlayersReady", allPlayersReady));
    }

    public static GameEventDto gameStarted(Game game, Player currentTurnPlayer, Instant now) {
        return of(GameEventType.GAME_STARTED, game, now, payload(
                "currentTurn", currentTurnPlayer.getId(),
                "currentPlayerName", currentTurnPlayer.getName(),
                "turnTimeoutMs", game.getConfiguration().getTurnTimeoutMs()));
    }

    public static GameEventDto attackMade(Game game, Player attacker, Player target, Coordinate position,
                                          ShotResult result, Ship sunkShip, Player next, Instant now) {
        return of(GameEventType.ATTACK_MADE, game, now, payload(
                "attackerId", attacker.getId(),
                "attackerName", attacker.getName(),
                "targetId", target.getId(),
                "targetName", target.getName(),
                "position", position.toString(),
                "result", result.name().toLowerCase(),
                "sunkShip", sunkShip == null ? null : ShipDto.from(sunkShip),
                "nextTurn", next == null ? null : next.getId(),
                "nextPlayerName", next == null ? null : next.getName()));
    }

    public static GameEventDto turnTimeout(Game game, Player timedOut, Player next, int turnNumber, Instant now) {
        return of(GameEventType.TURN_TIMEOUT, game, now, payload(
                "playerId", timedOut.getId(),
                "playerName", timedOut.getName(),
                "turnNumber", turnNumber,
                "nextTurn", next.getId(),
                "nextPlayerName", next.getName()));
    }

    public static GameEventDto gameFinished(Game game, Player winner, Player loser, Instant now) {
        return of(GameEventType.GAME_FINISHED, game, now, payload(
                "winnerId", winner.getId(),
                "winnerName", winner.getName(),
                "loserId", loser.getId(),
                "loserName", loser.getName()));
    }

    public static GameEventDto gameAbandoned(Game game, String reason, Instant now) {
        return of(GameEventType.GAME_ABANDONED, game, now, payload("reason", reason));
    }

    public static GameEventDto gamePaused(Game game, PauseRecord pause, Player pausedBy, Instant now) {
        return of(GameEventType.GAME_PAUSED, game, now, payload(
                "playerId", pausedBy == null ? null : pausedBy.getId(),
                "playerName", pausedBy == null ? null : pausedBy.getName(),
                "reason", pause.reason().wireName(),
                "pausedAt", pause.pausedAt(),
                "currentTurn", game.getCurrentTurn()));
    }

    public static GameEventDto gameResumed(Game game, String reason, Long remainingTurnMs, Instant now) {
        return of(GameEventType.GAME_RESUMED, game, now, payload(
                "resumedAt", now,
                "currentTurn", game.getCurrentTurn(),
                "reason", reason,
                "remainingTurnMs", remainingTurnMs));
    }

    public static GameEventDto playerDisconnected(PlayerConnection connection, int remainingPlayers,
                                                  String reason, Instant now) {
        return new GameEventDto(GameEventType.PLAYER_DISCONNECTED, connection.getGameId(), null, now, payload(
                "playerId", connection.getPlayerId(),
                "playerName", connection.getPlayerName(),
                "remainingPlayers", remainingPlayers,
                "reason", reason));
    }

    public static GameEventDto playerReconnected(PlayerConnection connection, Instant now) {
        return new GameEventDto(GameEventType.PLAYER_RECONNECTED, connection.getGameId(), null, now, payload(
                "playerId", connection.getPlayerId(),
                "playerName", connection.getPlayerName(),
                "sessionId", connection.getSessionId()));
    }

    public static GameEventDto reconnectionAvailable(DisconnectedSession session, Instant now) {
        return new GameEventDto(GameEventType.RECONNECTION_AVAILABLE, session.gameId(), null, now, payload(
                "playerId", session.playerId(),
                "playerName", session.playerName(),
                "sessionId", session.sessionId(),
                "availableUntil", session.expiresAt()));
    }

    public static GameEventDto connectionEstablished(PlayerConnection connection, boolean reconnected, Instant now) {
        return new GameEventDto(GameEventType.CONNECTION_ESTABLISHED, connection.getGameId(), null, now, payload(
                "playerId", connection.getPlayerId(),
                "playerName", connection.getPlayerName(),
                "sessionId", connection.getSessionId(),
                "reconnected", reconnected));
    }

    public static GameEventDto heartbeat(String gameId, Instant now) {
        return new GameEventDto(GameEventType.HEARTBEAT, gameId, null, now, payload("timestamp", now));
    }

    private static GameEventDto of(GameEventType type, Game game, Instant now, Map<String, Object> payload) {
        return new GameEventDto(type, game.getId(), game.getPhase(), now, payload);
    }

    // Map.of rejects null values, optional fields are sent as explicit nulls
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
