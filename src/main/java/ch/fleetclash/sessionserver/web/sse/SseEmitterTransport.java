package ch.fleetclash.sessionserver.web.sse;

import ch.fleetclash.sessionserver.service.transport.PushTransport;
import ch.fleetclash.sessionserver.web.api.dto.GameEventDto;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PushTransport} writing Server-Sent Events through a Spring MVC {@link SseEmitter}.
 *
 * <p>Each event carries an increasing id and the event type as SSE event name, with the
 * JSON-serialized {@link GameEventDto} as data.
 */
public class SseEmitterTransport implements PushTransport {

    private final SseEmitter emitter;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    public SseEmitterTransport(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public synchronized void send(GameEventDto event) throws IOException {
        if (closed.get()) {
            throw new IOException("SSE stream already closed");
        }
        emitter.send(SseEmitter.event()
                .id(Long.toString(sequence.incrementAndGet()))
                .name(event.type().wireName())
                .data(event, MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    /**
     * Marks the stream closed after the servlet container reported completion, timeout or error.
     */
    public void markClosed() {
        closed.set(true);
    }

    public SseEmitter getEmitter() {
        return emitter;
    }
}
