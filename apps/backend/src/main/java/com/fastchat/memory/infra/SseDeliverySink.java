package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamEvent;
import com.fastchat.memory.exception.StreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One SSE response. Frames are pushed into a multicast sink that a controller returns as
 * {@code Flux<ServerSentEvent<String>>}; the stream completes after a done or error frame.
 */
@Slf4j
public class SseDeliverySink implements DeliverySink {

    private final Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
    private final ObjectMapper mapper;
    private volatile boolean open = true;

    public SseDeliverySink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Flux<ServerSentEvent<String>> flux() {
        return sink.asFlux();
    }

    @Override
    public Mono<Void> send(StreamEvent event) {
        return Mono.defer(() -> {
            String json;
            try {
                json = mapper.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                return Mono.error(new StreamException("Unserializable stream event", event.requestId(), e));
            }
            Sinks.EmitResult result = sink.tryEmitNext(ServerSentEvent.<String>builder(json)
                    .event(event.type().wireName())
                    .id(event.requestId())
                    .build());
            if (result.isFailure()) {
                return Mono.error(new StreamException("SSE emit failed: " + result, event.requestId(), null));
            }
            if (event.type() == StreamEvent.Type.DONE || event.type() == StreamEvent.Type.ERROR) {
                close();
            }
            return Mono.<Void>empty();
        });
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        if (open) {
            open = false;
            sink.tryEmitComplete();
            log.debug("[Stream] SSE sink closed");
        }
    }
}
