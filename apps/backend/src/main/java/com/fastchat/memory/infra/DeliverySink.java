package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamEvent;
import reactor.core.publisher.Mono;

/**
 * Where stream frames go: a WebSocket connection or an SSE response.
 */
public interface DeliverySink {

    /** Completes once the frame is handed to the transport; errors if the transport rejected it. */
    Mono<Void> send(StreamEvent event);

    default boolean isOpen() {
        return true;
    }
}
