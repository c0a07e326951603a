package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamStatus;
import reactor.core.publisher.Mono;

/**
 * Caller's grip on a started stream.
 *
 * @param completion emits the terminal status once the request is released
 */
public record StreamHandle(String requestId, ActiveStream stream, Mono<StreamStatus> completion) {

    /** Idempotent; false when the stream had already finished or was cancelled before. */
    public boolean cancel() {
        return stream.cancel();
    }

    public StreamStatus status() {
        return stream.status();
    }
}
