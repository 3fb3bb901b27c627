package ch.fleetclash.sessionserver.web.ws;

import ch.fleetclash.sessionserver.exception.ExpiredCredentialException;
import ch.fleetclash.sessionserver.exception.GameException;
import ch.fleetclash.sessionserver.service.ConnectionHub;
import ch.fleetclash.sessionserver.service.GameSessionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Attaches STOMP sessions to the {@link ConnectionHub}.
 *
 * <p>A client subscribes to {@code /user/queue/games/{gameId}/events} with the native header
 * {@code playerId} and, when it comes back after a drop, {@code reconnectToken}. The subscription
 * becomes a hub connection backed by a {@link StompSessionTransport}. When the WebSocket session
 * closes, each of its hub connections is reported closed, which the hub treats as a disconnect.
 *
 * <p>An invalid reconnect token does not reject the subscription: the player gets a fresh
 * connection and can see from {@code connection_established} that no reconnection took place.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventListener {

    private static final String DESTINATION_PREFIX = "/user/queue/games/";
    private static final String DESTINATION_SUFFIX = "/events";

    private final ConnectionHub connectionHub;
    private final GameSessionEngine engine;
    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Hub connections per STOMP session id.
     */
    private final Map<String, List<Binding>> bindings = new ConcurrentHashMap<>();

    record Binding(String gameId, UUID playerId, StompSessionTransport transport) {}

    /**
     * Handles a subscription to a game event queue.
     *
     * @param event the subscription event containing session, destination and native headers
     */
    @EventListener
    public void handleSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String stompSessionId = accessor.getSessionId();
        String destination = accessor.getDestination();

        if (stompSessionId == null || destination == null) {
            return;
        }
        String gameId = extractGameId(destination);
        if (gameId == null) {
            return;
        }

        String rawPlayerId = accessor.getFirstNativeHeader("playerId");
        if (rawPlayerId == null) {
            log.warn("Subscription to {} without playerId header", destination);
            return;
        }

        UUID playerId;
        try {
            playerId = UUID.fromString(rawPlayerId);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid playerId in subscription header: {}", rawPlayerId);
            return;
        }

        String playerName;
        try {
            playerName = engine.requirePlayerName(gameId, playerId);
        } catch (GameException e) {
            log.warn("Rejected STOMP subscription of player {} to game {}: {}", playerId, gameId, e.getMessage());
            return;
        }

        String token = accessor.getFirstNativeHeader("reconnectToken");
        StompSessionTransport transport = new StompSessionTransport(messagingTemplate, stompSessionId, gameId);
        try {
            connectionHub.subscribe(gameId, playerId, playerName, transport, token);
        } catch (ExpiredCredentialException e) {
            log.warn("Reconnect token of player {} in game {} rejected, connecting as new session", playerName, gameId);
            connectionHub.subscribe(gameId, playerId, playerName, transport, null);
        }

        bindings.computeIfAbsent(stompSessionId, id -> new CopyOnWriteArrayList<>())
                .add(new Binding(gameId, playerId, transport));
    }

    /**
     * Handles the end of a WebSocket session (tab closed, network loss, explicit disconnect).
     *
     * @param event the disconnect event containing the STOMP session id
     */
    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String stompSessionId = event.getSessionId();
        if (stompSessionId == null) {
            return;
        }
        List<Binding> closed = bindings.remove(stompSessionId);
        if (closed == null) {
            log.debug("Disconnect for untracked session: {}", stompSessionId);
            return;
        }
        for (Binding binding : closed) {
            connectionHub.handleTransportClosed(binding.gameId(), binding.playerId(), binding.transport(), "socket_closed");
        }
    }

    /**
     * Extracts the game id from {@code /user/queue/games/{gameId}/events}.
     *
     * @return the game id, or {@code null} if the destination is not a game event queue
     */
    private String extractGameId(String destination) {
        if (!destination.startsWith(DESTINATION_PREFIX) || !destination.endsWith(DESTINATION_SUFFIX)) {
            return null;
        }
        String gameId = destination.substring(DESTINATION_PREFIX.length(),
                destination.length() - DESTINATION_SUFFIX.length());
        return gameId.isEmpty() || gameId.contains("/") ? null : gameId;
    }
}
