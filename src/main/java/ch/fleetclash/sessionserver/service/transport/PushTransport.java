package ch.fleetclash.sessionserver.service.transport;

import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;

import java.io.IOException;

/**
 * Server-push channel of one subscriber.
 *
 * <p>Implementations frame the event for their wire protocol (SSE, STOMP). Writes on one transport
 * are issued in order; a failing write is reported by throwing, after which the hub evicts the
 * connection.
 */
public interface PushTransport {

    /**
     * Writes one framed event.
     *
     * @throws IOException if the channel is no longer writable
     */
    void send(GameEventDto event) throws IOException;

    /**
     * Signals the peer that the channel is closed. Must be safe to call more than once.
     */
    void close();
}
