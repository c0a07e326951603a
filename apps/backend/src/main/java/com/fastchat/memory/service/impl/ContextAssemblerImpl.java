package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.ContextOptions;
import com.fastchat.memory.api.dto.MemoryContext;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Role;
import com.fastchat.memory.config.MemoryBackend;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.service.ContextAssembler;
import com.fastchat.memory.service.MemoryStore;
import com.fastchat.memory.service.SimilarMessageSearch;
import com.fastchat.memory.util.TokenEstimator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContextAssemblerImpl implements ContextAssembler {

    /** Guards against a corrupted parent chain. */
    private static final int MAX_LINEAGE_DEPTH = 32;

    private static final Comparator<Message> CHRONOLOGICAL = Comparator.comparingLong(Message::getTimestamp);

    private final MemoryStore store;
    private final MemoryProperties props;
    private final MemoryBackend backend;
    private final ObjectProvider<SimilarMessageSearch> similarSearch;

    @Override
    public Mono<MemoryContext> assembleContext(String sessionId, ContextOptions options) {
        ContextOptions opts = options == null ? ContextOptions.defaults() : options;
        int maxMessages = opts.getMaxMessages() != null && opts.getMaxMessages() > 0
                ? opts.getMaxMessages()
                : props.getContext().getMaxMessages();
        long window = (long) maxMessages + Math.max(0, props.getContext().getFetchSlack());
        Optional<String> branchId = opts.branch();

        MessageRange range = opts.isPreferRecent() ? MessageRange.last(window) : MessageRange.of(0, window);
        Mono<List<Message>> own = store.getMessages(sessionId, branchId, range).collectList();
        Mono<List<Message>> ancestry = opts.isIncludeAncestry() && branchId.isPresent()
                ? lineage(branchId.get(), 0)
                : Mono.just(List.of());

        return Mono.zip(ancestry, own).flatMap(t -> {
            List<Message> fetched = new ArrayList<>(t.getT1());
            fetched.addAll(t.getT2());
            if (fetched.isEmpty()) {
                log.debug("[Context] empty sessionId={} branchId={}", sessionId, opts.getBranchId());
                return Mono.just(MemoryContext.empty(sessionId, opts.getBranchId()));
            }
            if (!opts.isIncludeSystemPrompt()) {
                return Mono.just(build(sessionId, opts, fetched, null, maxMessages));
            }
            Optional<Message> latestSystem = latestSystem(fetched);
            List<Message> conversational = fetched.stream().filter(m -> m.getRole() != Role.SYSTEM).toList();
            Mono<String> prompt = latestSystem.isPresent()
                    ? Mono.justOrEmpty(latestSystem.get().getContent())
                    : fallbackSystemPrompt(sessionId, branchId, opts.isIncludeAncestry());
            return prompt
                    .map(p -> build(sessionId, opts, conversational, p, maxMessages))
                    .switchIfEmpty(Mono.fromSupplier(() -> build(sessionId, opts, conversational, null, maxMessages)));
        });
    }

    private MemoryContext build(String sessionId, ContextOptions opts, List<Message> candidates,
                                String systemPrompt, int maxMessages) {
        int charsPerToken = props.getContext().getCharsPerToken();
        List<Message> sorted = new ArrayList<>(candidates);
        sorted.sort(CHRONOLOGICAL);

        List<Message> selected = opts.isPreferRecent()
                ? sorted.subList(Math.max(0, sorted.size() - maxMessages), sorted.size())
                : sorted.subList(0, Math.min(sorted.size(), maxMessages));

        // walk in preference order, stop at the first message that would overflow
        List<Message> walk = new ArrayList<>(selected);
        if (opts.isPreferRecent()) {
            Collections.reverse(walk);
        }
        List<Message> kept = new ArrayList<>();
        int used = 0;
        Integer budget = opts.getMaxTokens();
        for (Message m : walk) {
            int cost = TokenEstimator.estimate(m, charsPerToken);
            if (budget != null && used + cost > budget) {
                break;
            }
            kept.add(m);
            used += cost;
        }
        kept.sort(CHRONOLOGICAL);

        int tokenCount = used + TokenEstimator.estimate(systemPrompt, charsPerToken);
        log.debug("[Context] assembled sessionId={} branchId={} messages={}/{} tokens={} systemPrompt={}",
                sessionId, opts.getBranchId(), kept.size(), candidates.size(), tokenCount, systemPrompt != null);
        return new MemoryContext(kept, systemPrompt,
                new MemoryContext.Metadata(sessionId, opts.getBranchId(), tokenCount, kept.size()));
    }

    /**
     * The fetched window may have cut the system message off: look at the whole timeline,
     * then at the ancestors the branch was forked from.
     */
    private Mono<String> fallbackSystemPrompt(String sessionId, Optional<String> branchId, boolean ancestryScanned) {
        Mono<String> fromTimeline = store.getMessages(sessionId, branchId, MessageRange.all())
                .collectList()
                .flatMap(all -> Mono.justOrEmpty(latestSystem(all)))
                .map(Message::getContent);
        if (branchId.isEmpty() || ancestryScanned) {
            return fromTimeline;
        }
        return fromTimeline.switchIfEmpty(Mono.defer(() -> lineage(branchId.get(), 0)
                .flatMap(ancestors -> Mono.justOrEmpty(latestSystem(ancestors)))
                .map(Message::getContent)));
    }

    /**
     * Messages a branch inherits: its parent's timeline up to and including the origin message,
     * preceded by the parent's own inheritance. Oldest first.
     */
    private Mono<List<Message>> lineage(String branchId, int depth) {
        if (depth >= MAX_LINEAGE_DEPTH) {
            log.warn("[Context] lineage too deep, stopping branchId={}", branchId);
            return Mono.just(List.of());
        }
        return store.getBranch(branchId)
                .flatMap(branch -> store.getMessage(branch.getOriginMessageId())
                        .flatMap(origin -> inherited(branch, origin, depth)))
                .defaultIfEmpty(List.of());
    }

    private Mono<List<Message>> inherited(Branch branch, Message origin, int depth) {
        Mono<List<Message>> parentTimeline = store
                .getMessages(branch.getSessionId(), branch.parentBranch(), MessageRange.all())
                .filter(m -> m.getTimestamp() <= origin.getTimestamp())
                .collectList();
        Mono<List<Message>> upstream = branch.parentBranch()
                .map(parent -> lineage(parent, depth + 1))
                .orElseGet(() -> Mono.just(List.of()));
        return Mono.zip(upstream, parentTimeline).map(t -> {
            List<Message> out = new ArrayList<>(t.getT1());
            out.addAll(t.getT2());
            return out;
        });
    }

    private static Optional<Message> latestSystem(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.getRole() == Role.SYSTEM)
                .max(CHRONOLOGICAL);
    }

    @Override
    public Flux<Message> findRelevantMessages(String sessionId, String query, int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        if (backend instanceof MemoryBackend.RedisWithVector vector) {
            SimilarMessageSearch search = similarSearch.getIfAvailable();
            if (search != null) {
                return search.findSimilar(sessionId, query, vector.threshold(), Math.min(limit, vector.limit()));
            }
        }
        return store.getMessages(sessionId, Optional.empty(), MessageRange.all())
                .collectList()
                .flatMapMany(history -> Flux.fromIterable(keywordMatch(sessionId, history, query, limit)));
    }

    private List<Message> keywordMatch(String sessionId, List<Message> history, String query, int limit) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<Message> matches = new ArrayList<>();
        if (!normalized.isEmpty()) {
            for (int i = history.size() - 1; i >= 0 && matches.size() < limit; i--) {
                Message m = history.get(i);
                if (m.getContent() != null && m.getContent().toLowerCase(Locale.ROOT).contains(normalized)) {
                    matches.add(m);
                }
            }
            Collections.reverse(matches);
            if (!matches.isEmpty()) {
                log.debug("[Context] relevant search matched {} message(s) sessionId={} query='{}'",
                        matches.size(), sessionId, query);
                return matches;
            }
        }
        List<Message> fallback = history.subList(Math.max(0, history.size() - limit), history.size());
        log.debug("[Context] relevant search fallback returning {} message(s) sessionId={} query='{}'",
                fallback.size(), sessionId, query);
        return List.copyOf(fallback);
    }
}
