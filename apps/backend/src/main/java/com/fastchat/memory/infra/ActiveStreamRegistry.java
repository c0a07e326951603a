package com.fastchat.memory.infra;

import com.fastchat.memory.api.dto.StreamProgress;
import com.fastchat.memory.config.MemoryProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-owned table of live streams, indexed by request id and by the message id the reply
 * will be stored under. A janitor cancels streams that outlive {@code fastchat.memory.stream.max-age}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActiveStreamRegistry {

    private final MemoryProperties props;
    private final Clock clock;

    /** requestId -> stream */
    private final Map<String, ActiveStream> streams = new ConcurrentHashMap<>();
    /** messageId -> requestId */
    private final Map<String, String> byMessageId = new ConcurrentHashMap<>();

    private Disposable janitor;

    @PostConstruct
    public void init() {
        MemoryProperties.Stream cfg = props.getStream();
        this.janitor = Flux.interval(cfg.getJanitorEvery(), Schedulers.boundedElastic())
                .doOnNext(t -> cancelExpired())
                .onErrorContinue((e, o) -> log.warn("[Stream] janitor error: {}", e.toString()))
                .subscribe();
        log.info("[Stream] ActiveStreamRegistry started. maxAge={}, janitorEvery={}",
                cfg.getMaxAge(), cfg.getJanitorEvery());
    }

    @PreDestroy
    public void shutdown() {
        if (janitor != null) {
            janitor.dispose();
            janitor = null;
        }
        List.copyOf(streams.values()).forEach(ActiveStream::cancel);
        streams.clear();
        byMessageId.clear();
        log.info("[Stream] ActiveStreamRegistry stopped.");
    }

    void register(ActiveStream stream) {
        streams.put(stream.getRequestId(), stream);
        byMessageId.put(stream.getRequest().messageId(), stream.getRequestId());
    }

    void release(ActiveStream stream) {
        streams.remove(stream.getRequestId(), stream);
        byMessageId.remove(stream.getRequest().messageId(), stream.getRequestId());
    }

    public Optional<ActiveStream> get(String requestId) {
        return Optional.ofNullable(streams.get(requestId));
    }

    public Optional<ActiveStream> findByMessageId(String messageId) {
        return Optional.ofNullable(byMessageId.get(messageId)).map(streams::get);
    }

    public Optional<StreamProgress> progress(String requestId) {
        return get(requestId).map(ActiveStream::progress);
    }

    public int size() {
        return streams.size();
    }

    /** Cancels every stream started more than max-age ago. */
    public int cancelExpired() {
        long cutoff = clock.millis() - props.getStream().getMaxAge().toMillis();
        int cancelled = 0;
        for (ActiveStream s : List.copyOf(streams.values())) {
            if (s.getStartTime() < cutoff && s.cancel()) {
                cancelled++;
                log.warn("[Stream] abandoned stream cancelled requestId={} messageId={}",
                        s.getRequestId(), s.getRequest().messageId());
            }
        }
        return cancelled;
    }
}
