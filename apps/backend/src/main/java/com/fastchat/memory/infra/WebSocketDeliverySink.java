package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamEvent;
import com.fastchat.memory.exception.StreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

/**
 * Sends each frame as a JSON text message on a WebFlux WebSocket session.
 * The session is shared by every stream of the connection and is never closed here.
 */
public class WebSocketDeliverySink implements DeliverySink {

    private final WebSocketSession session;
    private final ObjectMapper mapper;

    public WebSocketDeliverySink(WebSocketSession session, ObjectMapper mapper) {
        this.session = session;
        this.mapper = mapper;
    }

    public String connectionId() {
        return session.getId();
    }

    @Override
    public Mono<Void> send(StreamEvent event) {
        return Mono.defer(() -> {
            try {
                String json = mapper.writeValueAsString(event);
                return session.send(Mono.just(session.textMessage(json)));
            } catch (JsonProcessingException e) {
                return Mono.error(new StreamException("Unserializable stream event", event.requestId(), e));
            }
        });
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
