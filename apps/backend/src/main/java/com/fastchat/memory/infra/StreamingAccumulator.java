package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.api.dto.StreamEvent;
import com.fastchat.memory.api.dto.StreamProgress;
import com.fastchat.memory.api.dto.StreamRequest;
import com.fastchat.memory.api.dto.StreamStatus;
import com.fastchat.memory.api.dto.TokenChunk;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.MemoryException;
import com.fastchat.memory.exception.StreamException;
import com.fastchat.memory.service.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges a model's token flux to a delivery sink while accumulating the full reply.
 *
 * <ul>
 *   <li>every token is appended, reported to {@link StreamCallbacks#onToken} and written to the sink</li>
 *   <li>on completion the reply is stored as an assistant message, then {@code onComplete} fires</li>
 *   <li>on failure {@code onError} fires and nothing is stored</li>
 *   <li>{@link #cancel} stops the source, silences the sink and releases the request</li>
 * </ul>
 * A silent token source fails after {@code stream.idle-timeout}; a stuck sink write after
 * {@code stream.sink-write-timeout}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamingAccumulator {

    private final MemoryStore store;
    private final ActiveStreamRegistry registry;
    private final MemoryProperties props;
    private final Clock clock;

    public StreamHandle streamResponse(StreamRequest request, Flux<TokenChunk> tokens,
                                       DeliverySink sink, StreamCallbacks callbacks) {
        StreamCallbacks cb = callbacks == null ? StreamCallbacks.NOOP : callbacks;
        String requestId = UUID.randomUUID().toString();
        ActiveStream stream = new ActiveStream(requestId, request, clock.millis());
        Sinks.One<StreamStatus> done = Sinks.one();

        stream.onCancelled(() -> {
            log.debug("[Stream] cancelled requestId={} messageId={} tokens={}",
                    requestId, request.messageId(), stream.progress().tokensReceived());
            release(stream, done);
        });
        registry.register(stream);

        Duration idle = props.getStream().getIdleTimeout();
        Duration writeTimeout = props.getStream().getSinkWriteTimeout();

        Mono<Void> pipeline = write(sink, StreamEvent.start(requestId, request.sessionId(), request.messageId()), writeTimeout)
                .thenMany(tokens.timeout(idle)
                        .filter(chunk -> chunk != null && !chunk.isEmpty())
                        .concatMap(chunk -> {
                            if (stream.status() != StreamStatus.STREAMING) {
                                return Mono.empty();
                            }
                            stream.append(chunk.token());
                            cb.onToken(chunk.token());
                            return write(sink, StreamEvent.token(requestId, request.sessionId(),
                                    request.messageId(), chunk.token()), writeTimeout);
                        }))
                .then(Mono.defer(() -> complete(stream, sink, cb, done, writeTimeout)));

        log.debug("[Stream] start requestId={} sessionId={} messageId={} connection={}",
                requestId, request.sessionId(), request.messageId(), request.connectionId());
        stream.attachUpstream(pipeline.subscribe(
                v -> { },
                err -> fail(stream, sink, cb, done, err, writeTimeout)));
        return new StreamHandle(requestId, stream, done.asMono());
    }

    private Mono<Void> complete(ActiveStream stream, DeliverySink sink, StreamCallbacks cb,
                                Sinks.One<StreamStatus> done, Duration writeTimeout) {
        if (!stream.transition(StreamStatus.STREAMING, StreamStatus.COMPLETING)) {
            return Mono.empty();
        }
        StreamRequest req = stream.getRequest();
        String content = stream.content();
        Message reply = toMessage(req, content);
        return store.addMessage(reply)
                .then(Mono.fromRunnable(() -> {
                    stream.transition(StreamStatus.COMPLETING, StreamStatus.COMPLETED);
                    log.debug("[Stream] complete requestId={} messageId={} chars={}",
                            stream.getRequestId(), req.messageId(), content.length());
                    cb.onComplete(reply);
                }))
                .then(write(sink, StreamEvent.done(stream.getRequestId(), req.sessionId(), req.messageId(), content),
                        writeTimeout)
                        .onErrorResume(e -> {
                            log.warn("[Stream] done frame not delivered requestId={} err={}",
                                    stream.getRequestId(), e.toString());
                            return Mono.empty();
                        }))
                .doFinally(s -> {
                    if (stream.status() == StreamStatus.COMPLETED) {
                        release(stream, done);
                    }
                });
    }

    private void fail(ActiveStream stream, DeliverySink sink, StreamCallbacks cb,
                      Sinks.One<StreamStatus> done, Throwable err, Duration writeTimeout) {
        boolean failed = stream.transition(StreamStatus.STREAMING, StreamStatus.FAILED)
                || stream.transition(StreamStatus.COMPLETING, StreamStatus.FAILED);
        if (!failed) {
            log.warn("[Stream] error after terminal state ignored requestId={} status={} err={}",
                    stream.getRequestId(), stream.status(), err.toString());
            return;
        }
        StreamRequest req = stream.getRequest();
        Throwable reported = err instanceof MemoryException
                ? err
                : new StreamException("Stream failed: " + err, stream.getRequestId(), err);
        log.error("[Stream] failed requestId={} messageId={} err={}",
                stream.getRequestId(), req.messageId(), err.toString());
        try {
            cb.onError(reported);
        } finally {
            release(stream, done);
            write(sink, StreamEvent.error(stream.getRequestId(), req.sessionId(), req.messageId(),
                    reported.getMessage()), writeTimeout)
                    .subscribe(v -> { },
                            e -> log.warn("[Stream] error frame not delivered requestId={} err={}",
                                    stream.getRequestId(), e.toString()));
        }
    }

    private Message toMessage(StreamRequest req, String content) {
        long now = clock.millis();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(Message.META_PERSISTED_AT, now);
        if (req.modelId() != null) {
            meta.put(Message.META_MODEL, req.modelId());
        }
        return Message.builder()
                .id(req.messageId())
                .sessionId(req.sessionId())
                .role(Role.ASSISTANT)
                .content(content)
                .timestamp(now)
                .branchId(req.branchId())
                .parentMessageId(req.parentMessageId())
                .metadata(meta)
                .build();
    }

    private static Mono<Void> write(DeliverySink sink, StreamEvent event, Duration timeout) {
        if (!sink.isOpen()) {
            return Mono.error(new StreamException("Delivery sink closed", event.requestId(), null));
        }
        return sink.send(event).timeout(timeout);
    }

    private void release(ActiveStream stream, Sinks.One<StreamStatus> done) {
        registry.release(stream);
        done.tryEmitValue(stream.status());
    }

    // ---------- out-of-band control ----------

    public boolean cancel(String requestId) {
        return registry.get(requestId).map(ActiveStream::cancel).orElse(false);
    }

    public boolean cancelByMessageId(String messageId) {
        return registry.findByMessageId(messageId).map(ActiveStream::cancel).orElse(false);
    }

    public Optional<StreamProgress> getStreamProgress(String requestId) {
        return registry.progress(requestId);
    }

    /** Content accumulated so far for the reply that will be stored under {@code messageId}. */
    public Optional<String> getContentByMessageId(String messageId) {
        return registry.findByMessageId(messageId).map(ActiveStream::content);
    }

    public int activeStreamCount() {
        return registry.size();
    }
}
