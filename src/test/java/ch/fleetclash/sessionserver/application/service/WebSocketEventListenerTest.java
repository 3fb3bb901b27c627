package ch.fleetclash.sessionserver.application.service;

import ch.fleetclash.sessionserver.exception.ExpiredCredentialException;
import ch.fleetclash.sessionserver.exception.GameNotFoundException;
import ch.fleetclash.sessionserver.service.ConnectionHub;
import ch.fleetclash.sessionserver.service.GameSessionEngine;
import ch.fleetclash.sessionserver.service.transport.PushTransport;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import ch.fleetclash.sessionserver.web.ws.StompSessionTransport;
import ch.fleetclash.sessionserver.web.ws.WebSocketEventListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link WebSocketEventListener}.
 *
 * <p>Subscribe and disconnect events are built from real STOMP headers; the hub and the engine are
 * mocked.
 */
@ExtendWith(MockitoExtension.class)
class WebSocketEventListenerTest {

    private static final String GAME_ID = "game-1";
    private static final String SESSION_ID = "stomp-001";
    private static final UUID PLAYER_ID = UUID.fromString("70000000-0000-0000-0000-000000000001");

    @Mock
    private ConnectionHub connectionHub;

    @Mock
    private GameSessionEngine engine;

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private WebSocketEventListener listener;

    // ------------------------------------------------------------------------------------
    // handleSubscribe
    // ------------------------------------------------------------------------------------

    @Test
    void handleSubscribe_shouldAttachStompTransport_whenPlayerSubscribesToGameQueue() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenReturn("Alice");

        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), null));

        // Assert
        ArgumentCaptor<PushTransport> transport = ArgumentCaptor.forClass(PushTransport.class);
        verify(connectionHub).subscribe(eq(GAME_ID), eq(PLAYER_ID), eq("Alice"), transport.capture(), isNull());
        assertThat(transport.getValue()).isInstanceOf(StompSessionTransport.class);
        assertThat(((StompSessionTransport) transport.getValue()).getStompSessionId()).isEqualTo(SESSION_ID);
    }

    @Test
    void handleSubscribe_shouldForwardReconnectToken_whenHeaderIsPresent() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenReturn("Alice");

        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), "token-1"));

        // Assert
        verify(connectionHub).subscribe(eq(GAME_ID), eq(PLAYER_ID), eq("Alice"), any(StompSessionTransport.class), eq("token-1"));
    }

    @Test
    void handleSubscribe_shouldConnectAsNewSession_whenReconnectTokenIsRejected() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenReturn("Alice");
        when(connectionHub.subscribe(eq(GAME_ID), eq(PLAYER_ID), eq("Alice"), any(PushTransport.class), eq("stale")))
                .thenThrow(new ExpiredCredentialException("Invalid or expired reconnection token"));

        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), "stale"));

        // Assert
        verify(connectionHub).subscribe(eq(GAME_ID), eq(PLAYER_ID), eq("Alice"), any(StompSessionTransport.class), isNull());
    }

    @Test
    void handleSubscribe_shouldIgnoreSubscription_whenPlayerIdHeaderIsMissing() {
        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), null, null));

        // Assert
        verifyNoInteractions(engine, connectionHub);
    }

    @Test
    void handleSubscribe_shouldIgnoreSubscription_whenPlayerIdIsMalformed() {
        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), "not-a-uuid", null));

        // Assert
        verifyNoInteractions(engine, connectionHub);
    }

    @Test
    void handleSubscribe_shouldIgnoreDestinationsOutsideGameQueues() {
        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, "/topic/lobby", PLAYER_ID.toString(), null));
        listener.handleSubscribe(subscribeEvent(SESSION_ID, "/user/queue/games//events", PLAYER_ID.toString(), null));

        // Assert
        verifyNoInteractions(engine, connectionHub);
    }

    @Test
    void handleSubscribe_shouldNotAttach_whenPlayerIsNotPartOfGame() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenThrow(GameNotFoundException.player(GAME_ID, PLAYER_ID));

        // Act
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), null));

        // Assert
        verifyNoInteractions(connectionHub);
    }

    // ------------------------------------------------------------------------------------
    // handleDisconnect
    // ------------------------------------------------------------------------------------

    @Test
    void handleDisconnect_shouldReportSameTransportClosed_whenSessionHadSubscriptions() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenReturn("Alice");
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), null));
        ArgumentCaptor<PushTransport> subscribed = ArgumentCaptor.forClass(PushTransport.class);
        verify(connectionHub).subscribe(eq(GAME_ID), eq(PLAYER_ID), eq("Alice"), subscribed.capture(), isNull());

        // Act
        listener.handleDisconnect(disconnectEvent(SESSION_ID));

        // Assert
        verify(connectionHub).handleTransportClosed(GAME_ID, PLAYER_ID, subscribed.getValue(), "socket_closed");
    }

    @Test
    void handleDisconnect_shouldReportOnlyOnce_whenEventIsDeliveredTwice() {
        // Arrange
        when(engine.requirePlayerName(GAME_ID, PLAYER_ID)).thenReturn("Alice");
        listener.handleSubscribe(subscribeEvent(SESSION_ID, gameQueue(GAME_ID), PLAYER_ID.toString(), null));

        // Act
        listener.handleDisconnect(disconnectEvent(SESSION_ID));
        listener.handleDisconnect(disconnectEvent(SESSION_ID));

        // Assert
        verify(connectionHub).handleTransportClosed(eq(GAME_ID), eq(PLAYER_ID), any(PushTransport.class), eq("socket_closed"));
    }

    @Test
    void handleDisconnect_shouldDoNothing_whenSessionIsUntracked() {
        // Act
        listener.handleDisconnect(disconnectEvent("unknown-session"));

        // Assert
        verify(connectionHub, never()).handleTransportClosed(anyString(), any(UUID.class), any(PushTransport.class), anyString());
    }

    // ------------------------------------------------------------------------------------
    // StompSessionTransport
    // ------------------------------------------------------------------------------------

    @Test
    void stompTransport_shouldAddressSessionQueue_andRefuseWritesAfterClose() throws Exception {
        // Arrange
        StompSessionTransport transport = new StompSessionTransport(messagingTemplate, SESSION_ID, GAME_ID);
        GameEventDto heartbeat = GameEventDto.heartbeat(GAME_ID, Instant.parse("2026-01-01T12:00:00Z"));

        // Act
        transport.send(heartbeat);
        transport.close();

        // Assert
        verify(messagingTemplate).convertAndSendToUser(eq(SESSION_ID), eq("/queue/games/" + GAME_ID + "/events"),
                eq(heartbeat), anyMap());
        assertThat(catchThrowable(() -> transport.send(heartbeat))).isInstanceOf(IOException.class);
    }

    // ------------------------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------------------------

    private static String gameQueue(String gameId) {
        return "/user/queue/games/" + gameId + "/events";
    }

    private SessionSubscribeEvent subscribeEvent(String sessionId, String destination, String playerId, String token) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.SUBSCRIBE);
        accessor.setSessionId(sessionId);
        accessor.setDestination(destination);
        if (playerId != null) {
            accessor.setNativeHeader("playerId", playerId);
        }
        if (token != null) {
            accessor.setNativeHeader("reconnectToken", token);
        }
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionSubscribeEvent(this, message);
    }

    private SessionDisconnectEvent disconnectEvent(String sessionId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.DISCONNECT);
        accessor.setSessionId(sessionId);
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionDisconnectEvent(this, message, sessionId, CloseStatus.NORMAL);
    }
}
