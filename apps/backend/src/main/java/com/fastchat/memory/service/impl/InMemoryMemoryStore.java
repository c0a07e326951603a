package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.exception.StoreUnavailableException;
import com.fastchat.memory.infra.SessionLockManager;
import com.fastchat.memory.service.MemoryStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Single-process store backed by Caffeine caches. Every entry expires after the entity TTL
 * of inactivity, so reads and writes both refresh it.
 */
@Slf4j
public class InMemoryMemoryStore implements MemoryStore, AutoCloseable {

    private final MemoryKeys keys;
    private final SessionLockManager locks;
    private final Clock clock;

    private final Cache<String, Session> sessions;
    private final Cache<String, Message> messages;
    private final Cache<String, Branch> branches;
    private final Cache<String, OrderIndex> indexes;
    private final Cache<String, List<String>> versions;
    private final Cache<String, List<BranchHistoryEntry>> history;

    private volatile boolean open = true;

    public InMemoryMemoryStore(MemoryKeys keys, SessionLockManager locks, Clock clock, Duration ttl, Ticker ticker) {
        this.keys = keys;
        this.locks = locks;
        this.clock = clock;
        this.sessions = newCache(ttl, ticker);
        this.messages = newCache(ttl, ticker);
        this.branches = newCache(ttl, ticker);
        this.indexes = newCache(ttl, ticker);
        this.versions = newCache(ttl, ticker);
        this.history = newCache(ttl, ticker);
    }

    private static <V> Cache<String, V> newCache(Duration ttl, Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .ticker(ticker)
                .build();
    }

    @Override
    public Mono<Void> setSession(Session session) {
        return guarded(() -> {
            sessions.put(keys.session(session.getId()), session);
            return Mono.empty();
        });
    }

    @Override
    public Mono<Session> getSession(String sessionId) {
        return guarded(() -> Mono.justOrEmpty(sessions.getIfPresent(keys.session(sessionId))));
    }

    @Override
    public Mono<Session> updateSession(String sessionId, UnaryOperator<Session> mutation) {
        return withSessionLock(sessionId, () -> guarded(() -> {
            Session current = sessions.getIfPresent(keys.session(sessionId));
            if (current == null) {
                return Mono.empty();
            }
            Session next = mutation.apply(current);
            sessions.put(keys.session(sessionId), next);
            return Mono.just(next);
        }));
    }

    @Override
    public Mono<Void> deleteSession(String sessionId) {
        return guarded(() -> {
            Session session = sessions.getIfPresent(keys.session(sessionId));
            List<String> indexKeys = new ArrayList<>();
            indexKeys.add(keys.messages(sessionId));
            if (session != null) {
                for (String branchId : session.getBranches()) {
                    indexKeys.add(keys.branchMessages(branchId));
                    branches.invalidate(keys.branch(branchId));
                }
            }
            int removed = 0;
            for (String indexKey : indexKeys) {
                OrderIndex index = indexes.asMap().remove(indexKey);
                if (index == null) {
                    continue;
                }
                for (String id : index.ids(MessageRange.all())) {
                    messages.invalidate(keys.message(id));
                    versions.invalidate(keys.messageVersions(id));
                    removed++;
                }
            }
            history.invalidate(keys.branchHistory(sessionId));
            sessions.invalidate(keys.session(sessionId));
            log.debug("[Store] session deleted sessionId={} messages={}", sessionId, removed);
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> addMessage(Message message) {
        Objects.requireNonNull(message.getId(), "message.id");
        Objects.requireNonNull(message.getSessionId(), "message.sessionId");
        String sessionId = message.getSessionId();
        return withSessionLock(sessionId, () -> guarded(() -> {
            messages.put(keys.message(message.getId()), message);
            indexes.asMap().compute(keys.index(sessionId, message.branch()), (k, index) -> {
                OrderIndex target = index == null ? new OrderIndex() : index;
                target.add(message.getId(), message.getTimestamp());
                return target;
            });
            long now = clock.millis();
            Session current = sessions.getIfPresent(keys.session(sessionId));
            Session base = current == null ? Session.create(sessionId, now) : current;
            sessions.put(keys.session(sessionId), base.withAppendedMessage(now));
            log.debug("[Store] message added sessionId={} messageId={} branchId={}",
                    sessionId, message.getId(), message.getBranchId());
            return Mono.<Void>empty();
        }));
    }

    @Override
    public Mono<Message> getMessage(String messageId) {
        return guarded(() -> Mono.justOrEmpty(messages.getIfPresent(keys.message(messageId))));
    }

    @Override
    public Mono<Void> deleteMessage(String messageId) {
        return guarded(() -> {
            Message removed = messages.asMap().remove(keys.message(messageId));
            if (removed != null) {
                OrderIndex index = indexes.getIfPresent(keys.index(removed.getSessionId(), removed.branch()));
                if (index != null) {
                    index.remove(messageId);
                }
            }
            return Mono.empty();
        });
    }

    @Override
    public Flux<Message> getMessages(String sessionId, Optional<String> branchId, MessageRange range) {
        return guarded(() -> {
            OrderIndex index = indexes.getIfPresent(keys.index(sessionId, branchId));
            if (index == null) {
                return Mono.just(List.<Message>of());
            }
            List<Message> out = new ArrayList<>();
            for (String id : index.ids(range)) {
                Message m = messages.getIfPresent(keys.message(id));
                if (m != null) {
                    out.add(m);
                }
            }
            return Mono.just(out);
        }).flatMapIterable(list -> list);
    }

    @Override
    public Mono<Long> countMessages(String sessionId, Optional<String> branchId) {
        return guarded(() -> {
            OrderIndex index = indexes.getIfPresent(keys.index(sessionId, branchId));
            return Mono.just(index == null ? 0L : (long) index.size());
        });
    }

    @Override
    public Mono<Void> saveBranch(Branch branch) {
        return guarded(() -> {
            branches.put(keys.branch(branch.getId()), branch);
            return Mono.empty();
        });
    }

    @Override
    public Mono<Branch> getBranch(String branchId) {
        return guarded(() -> Mono.justOrEmpty(branches.getIfPresent(keys.branch(branchId))));
    }

    @Override
    public Mono<Void> deleteBranch(String branchId) {
        return guarded(() -> {
            branches.invalidate(keys.branch(branchId));
            indexes.invalidate(keys.branchMessages(branchId));
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> addMessageVersion(String rootMessageId, String versionMessageId) {
        return guarded(() -> {
            versions.asMap().computeIfAbsent(keys.messageVersions(rootMessageId), k -> new CopyOnWriteArrayList<>())
                    .add(versionMessageId);
            return Mono.empty();
        });
    }

    @Override
    public Flux<String> getMessageVersionIds(String rootMessageId) {
        return guarded(() -> Mono.just(List.copyOf(Optional.ofNullable(
                        versions.getIfPresent(keys.messageVersions(rootMessageId))).orElse(List.of()))))
                .flatMapIterable(list -> list);
    }

    @Override
    public Mono<Void> appendBranchHistory(BranchHistoryEntry entry) {
        return guarded(() -> {
            history.asMap().computeIfAbsent(keys.branchHistory(entry.sessionId()), k -> new CopyOnWriteArrayList<>())
                    .add(entry);
            return Mono.empty();
        });
    }

    @Override
    public Flux<BranchHistoryEntry> getBranchHistory(String sessionId) {
        return guarded(() -> Mono.just(List.copyOf(Optional.ofNullable(
                        history.getIfPresent(keys.branchHistory(sessionId))).orElse(List.of()))))
                .flatMapIterable(list -> list);
    }

    @Override
    public <T> Mono<T> withSessionLock(String sessionId, Supplier<Mono<T>> work) {
        if (!open) {
            return Mono.error(StoreUnavailableException.notInitialized("In-memory store"));
        }
        return locks.withLock(sessionId, work);
    }

    @Override
    public void close() {
        open = false;
        sessions.invalidateAll();
        messages.invalidateAll();
        branches.invalidateAll();
        indexes.invalidateAll();
        versions.invalidateAll();
        history.invalidateAll();
        log.info("[Store] in-memory store closed");
    }

    private <T> Mono<T> guarded(Supplier<Mono<T>> op) {
        return Mono.defer(() -> open
                ? op.get()
                : Mono.error(StoreUnavailableException.notInitialized("In-memory store")));
    }

    /**
     * Sorted-set equivalent: ordered by score, ties broken by member id.
     */
    static final class OrderIndex {

        private record Entry(String id, long score) { }

        private static final Comparator<Entry> ORDER =
                Comparator.comparingLong(Entry::score).thenComparing(Entry::id);

        private final TreeSet<Entry> entries = new TreeSet<>(ORDER);
        private final Map<String, Long> scores = new HashMap<>();

        synchronized void add(String id, long score) {
            Long previous = scores.put(id, score);
            if (previous != null) {
                entries.remove(new Entry(id, previous));
            }
            entries.add(new Entry(id, score));
        }

        synchronized void remove(String id) {
            Long previous = scores.remove(id);
            if (previous != null) {
                entries.remove(new Entry(id, previous));
            }
        }

        synchronized int size() {
            return entries.size();
        }

        synchronized List<String> ids(MessageRange range) {
            List<String> all = new ArrayList<>(entries.size());
            for (Entry e : entries) {
                all.add(e.id());
            }
            int size = all.size();
            int from;
            int to;
            if (range.fromEnd()) {
                to = size;
                from = range.unbounded() ? 0 : (int) Math.max(0, size - range.limit());
            } else {
                from = (int) Math.min(size, range.offset());
                to = range.unbounded() ? size : (int) Math.min(size, range.offset() + range.limit());
            }
            return List.copyOf(all.subList(from, to));
        }
    }
}
