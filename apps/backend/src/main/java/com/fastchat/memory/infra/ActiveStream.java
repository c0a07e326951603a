package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamProgress;
import com.fastchat.memory.api.dto.StreamRequest;
import com.fastchat.memory.api.dto.StreamStatus;
import lombok.Getter;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Accumulator state of one in-flight reply.
 */
public final class ActiveStream {

    @Getter
    private final String requestId;
    @Getter
    private final StreamRequest request;
    @Getter
    private final long startTime;

    private final AtomicReference<StreamStatus> status = new AtomicReference<>(StreamStatus.STREAMING);
    private final StringBuilder content = new StringBuilder(1024);
    private final AtomicLong tokens = new AtomicLong();
    private final Disposable.Swap upstream = Disposables.swap();
    private volatile Runnable onCancelled = () -> { };

    ActiveStream(String requestId, StreamRequest request, long startTime) {
        this.requestId = requestId;
        this.request = request;
        this.startTime = startTime;
    }

    public StreamStatus status() {
        return status.get();
    }

    boolean transition(StreamStatus from, StreamStatus to) {
        return status.compareAndSet(from, to);
    }

    void append(String token) {
        synchronized (content) {
            content.append(token);
        }
        tokens.incrementAndGet();
    }

    public String content() {
        synchronized (content) {
            return content.toString();
        }
    }

    void attachUpstream(Disposable subscription) {
        upstream.update(subscription);
    }

    void onCancelled(Runnable hook) {
        this.onCancelled = hook;
    }

    /**
     * Stops the token source and drops the request. Only a streaming request can be cancelled;
     * anything else (completing, finished, already cancelled) is a no-op.
     */
    public boolean cancel() {
        if (!status.compareAndSet(StreamStatus.STREAMING, StreamStatus.CANCELLED)) {
            return false;
        }
        upstream.dispose();
        onCancelled.run();
        return true;
    }

    public StreamProgress progress() {
        return new StreamProgress(requestId, request.connectionId(), request.sessionId(), request.messageId(),
                status.get(), startTime, tokens.get(), content());
    }
}
