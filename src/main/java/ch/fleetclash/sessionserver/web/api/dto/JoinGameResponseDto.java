package ch.fleetclash.sessionserver.web.api.dto;

import ch.fleetclash.sessionserver.domain.enums.GamePhase;

import java.util.UUID;

public record JoinGameResponseDto(
        String gameId,
        UUID playerId,
        String playerName,
        GamePhase phase,
        int playerCount
) {}
