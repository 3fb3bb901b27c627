package ch.fleetclash.sessionserver.web.api.dto;

import java.util.Map;

/**
 * Snapshot of the realtime layer for monitoring.
 *
 * @param totalConnections      live push channels
 * @param connectionsPerGame    live channels per game id
 * @param disconnectedSessions  players that can still reconnect
 * @param activeGames           games held in memory
 */
public record ConnectionStatsDto(
        int totalConnections,
        Map<String, Integer> connectionsPerGame,
        int disconnectedSessions,
        int activeGames
) {}
