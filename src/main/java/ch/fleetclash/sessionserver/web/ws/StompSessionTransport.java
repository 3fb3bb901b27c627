package ch.fleetclash.sessionserver.web.ws;

import ch.fleetclash.sessionserver.service.transport.PushTransport;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;

/**
 * {@link PushTransport} addressing one STOMP session.
 *
 * <p>Events go to {@code /user/queue/games/{gameId}/events} of the session only, using the session
 * id as user name so no authenticated principal is required.
 */
public class StompSessionTransport implements PushTransport {

    private final SimpMessagingTemplate messagingTemplate;
    private final String stompSessionId;
    private final String destination;
    private volatile boolean closed;

    public StompSessionTransport(SimpMessagingTemplate messagingTemplate, String stompSessionId, String gameId) {
        this.messagingTemplate = messagingTemplate;
        this.stompSessionId = stompSessionId;
        this.destination = "/queue/games/" + gameId + "/events";
    }

    @Override
    public void send(GameEventDto event) throws IOException {
        if (closed) {
            throw new IOException("STOMP session " + stompSessionId + " is closed");
        }
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(stompSessionId);
        headers.setLeaveMutable(true);
        try {
            messagingTemplate.convertAndSendToUser(stompSessionId, destination, event, headers.getMessageHeaders());
        } catch (MessagingException e) {
            throw new IOException("STOMP delivery failed", e);
        }
    }

    /**
     * STOMP sessions are closed by the client or the broker; the server only stops writing.
     */
    @Override
    public void close() {
        closed = true;
    }

    public String getStompSessionId() {
        return stompSessionId;
    }
}
