package ch.fleetclash.sessionserver.web.api.dto;

public record JoinGameRequest(
        String playerName
) {}
