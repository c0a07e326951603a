package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Session;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * TTL-bounded storage for sessions, messages, branches, version lists and branch history.
 * This is the only writer of memory state; everything else reads or derives.
 *
 * <p>Indices: the main timeline index of a session holds messages without a branch,
 * a branch index holds only messages appended directly to that branch.
 * Both are ordered by {@link Message#getTimestamp()}.</p>
 */
public interface MemoryStore {

    /** Upsert; refreshes the session TTL. */
    Mono<Void> setSession(Session session);

    /** Empty when the session does not exist (or expired). Reading refreshes the TTL. */
    Mono<Session> getSession(String sessionId);

    /**
     * Read-modify-write of a session under the session lock. Empty when the session is missing.
     */
    Mono<Session> updateSession(String sessionId, UnaryOperator<Session> mutation);

    /** Removes the session and every key derived from it. */
    Mono<Void> deleteSession(String sessionId);

    /**
     * Stores the body, indexes it in its timeline and bumps the session counters,
     * all under the session lock.
     *
     * @throws com.fastchat.memory.exception.LockTimeoutException       lock not acquired within the bounded wait
     * @throws com.fastchat.memory.exception.StoreUnavailableException  backing store not reachable or not initialized
     */
    Mono<Void> addMessage(Message message);

    Mono<Message> getMessage(String messageId);

    Mono<Void> deleteMessage(String messageId);

    /**
     * Messages of one timeline, oldest first.
     *
     * @param branchId empty selects the main timeline
     */
    Flux<Message> getMessages(String sessionId, Optional<String> branchId, MessageRange range);

    Mono<Long> countMessages(String sessionId, Optional<String> branchId);

    Mono<Void> saveBranch(Branch branch);

    Mono<Branch> getBranch(String branchId);

    /** Removes the branch record and its message index (not the message bodies). */
    Mono<Void> deleteBranch(String branchId);

    Mono<Void> addMessageVersion(String rootMessageId, String versionMessageId);

    /** Version ids in the order they were added. */
    Flux<String> getMessageVersionIds(String rootMessageId);

    Mono<Void> appendBranchHistory(BranchHistoryEntry entry);

    /** History entries in the order they were recorded. */
    Flux<BranchHistoryEntry> getBranchHistory(String sessionId);

    /**
     * Runs {@code work} while holding the session lock. The lock is released however the work ends.
     * Not re-entrant: {@code work} must not call locking operations of this store for the same session.
     */
    <T> Mono<T> withSessionLock(String sessionId, Supplier<Mono<T>> work);
}
