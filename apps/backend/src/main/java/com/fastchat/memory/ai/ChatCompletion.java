package com.fastchat.memory.ai;

import com.fastchat.memory.api.dto.TokenChunk;
import reactor.core.publisher.Flux;

/**
 * What a model call produced: either the whole reply or a token source still being generated.
 */
public sealed interface ChatCompletion permits ChatCompletion.Complete, ChatCompletion.Streaming {

    record Complete(String text) implements ChatCompletion { }

    /** Cancelling the subscription to {@code tokens} must stop generation upstream. */
    record Streaming(Flux<TokenChunk> tokens) implements ChatCompletion { }
}
