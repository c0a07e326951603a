package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.Message;

/**
 * Observer of one streamed reply. For a given request exactly one of
 * {@link #onComplete} and {@link #onError} fires, or neither when it is cancelled.
 */
public interface StreamCallbacks {

    StreamCallbacks NOOP = new StreamCallbacks() { };

    default void onToken(String token) {
    }

    /** Called after the reply was persisted. */
    default void onComplete(Message persisted) {
    }

    default void onError(Throwable error) {
    }
}
