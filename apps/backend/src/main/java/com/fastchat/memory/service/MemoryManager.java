package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.ArchiveQuery;
import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchCleanupOptions;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.BranchOptions;
import com.fastchat.memory.api.dto.ContextOptions;
import com.fastchat.memory.api.dto.MemoryContext;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.ModelConfig;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.infra.RetrySupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * Single entry point over the memory engine. Transient failures are retried with backoff,
 * every stored message is mirrored to the archive, and reads fall back to the archive once
 * the TTL-bounded store has forgotten a session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryManager {

    private final MemoryStore store;
    private final ContextAssembler contextAssembler;
    private final BranchManager branchManager;
    private final ArchivalSink archivalSink;
    private final RetrySupport retry;
    private final Clock clock;

    // ---------- sessions ----------

    public Mono<Session> createSession(String sessionId, String modelId, ModelConfig modelConfig) {
        return Mono.defer(() -> {
            Session.SessionBuilder builder = Session.create(sessionId, clock.millis()).toBuilder()
                    .modelConfig(modelConfig);
            if (modelId != null) {
                builder.modelId(modelId);
            }
            Session session = builder.build();
            return retry.withRetry("setSession", store.setSession(session)).thenReturn(session);
        });
    }

    public Mono<Session> getSession(String sessionId) {
        return retry.withRetry("getSession", store.getSession(sessionId));
    }

    public Mono<Void> deleteSession(String sessionId) {
        return retry.withRetry("deleteSession", store.deleteSession(sessionId))
                .doOnSuccess(v -> mirror("deleteSession " + sessionId, archivalSink.deleteSession(sessionId)));
    }

    // ---------- messages ----------

    public Mono<Message> storeMessage(Message message) {
        return retry.withRetry("addMessage", store.addMessage(message))
                .doOnSuccess(v -> mirrorToArchive(message))
                .thenReturn(message);
    }

    public Mono<Message> getMessage(String messageId) {
        return retry.withRetry("getMessage", store.getMessage(messageId));
    }

    public Mono<Void> deleteMessage(String messageId) {
        return retry.withRetry("deleteMessage", store.deleteMessage(messageId));
    }

    public Flux<Message> getMessages(String sessionId, Optional<String> branchId, MessageRange range) {
        return retry.withRetry("getMessages", store.getMessages(sessionId, branchId, range))
                .switchIfEmpty(Flux.defer(() -> {
                    if (!archivalSink.isEnabled()) {
                        return Flux.empty();
                    }
                    log.debug("[Archive] store empty, reading archive sessionId={} branchId={}",
                            sessionId, branchId.orElse(null));
                    return archivalSink.queryMessages(sessionId, ArchiveQuery.timeline(branchId.orElse(null), range))
                            .onErrorResume(e -> {
                                log.warn("[Archive] fallback read failed sessionId={} err={}", sessionId, e.toString());
                                return Flux.empty();
                            });
                }));
    }

    // ---------- context ----------

    public Mono<MemoryContext> getContext(String sessionId, ContextOptions options) {
        return retry.withRetry("assembleContext", contextAssembler.assembleContext(sessionId, options));
    }

    public Flux<Message> findRelevantMessages(String sessionId, String query, int limit) {
        return retry.withRetry("findRelevant", contextAssembler.findRelevantMessages(sessionId, query, limit));
    }

    // ---------- branches ----------

    public Mono<Branch> createBranch(String sessionId, String originMessageId, BranchOptions options) {
        return retry.withRetry("createBranch", branchManager.createBranch(sessionId, originMessageId, options));
    }

    public Flux<Branch> getBranches(String sessionId, boolean includeArchived) {
        return retry.withRetry("getBranches", branchManager.getBranches(sessionId, includeArchived));
    }

    public Mono<Branch> getBranch(String branchId) {
        return retry.withRetry("getBranch", branchManager.getBranch(branchId));
    }

    public Mono<Branch> switchBranch(String sessionId, String branchId) {
        return retry.withRetry("switchBranch", branchManager.switchBranch(sessionId, branchId));
    }

    public Mono<Void> switchToMain(String sessionId) {
        return retry.withRetry("switchToMain", branchManager.switchToMain(sessionId));
    }

    public Mono<Branch> mergeBranches(String sessionId, String sourceBranchId, String targetBranchId) {
        // merge copies carry deterministic ids, so a retried merge cannot duplicate
        return retry.withRetry("mergeBranches", branchManager.mergeBranches(sessionId, sourceBranchId, targetBranchId));
    }

    /** Not retried: a replay after a partial failure would store a second version. */
    public Mono<Message> editMessage(String messageId, String newContent) {
        return branchManager.editMessage(messageId, newContent)
                .doOnNext(this::mirrorToArchive);
    }

    public Flux<Message> getMessageVersions(String messageId) {
        return retry.withRetry("getMessageVersions", branchManager.getMessageVersions(messageId));
    }

    public Mono<Branch> archiveBranch(String sessionId, String branchId) {
        return retry.withRetry("archiveBranch", branchManager.archiveBranch(sessionId, branchId));
    }

    public Mono<Void> deleteBranch(String sessionId, String branchId, boolean deleteMessages) {
        return retry.withRetry("deleteBranch", branchManager.deleteBranch(sessionId, branchId, deleteMessages));
    }

    public Flux<BranchHistoryEntry> getBranchHistory(String sessionId) {
        return retry.withRetry("getBranchHistory", branchManager.getBranchHistory(sessionId));
    }

    public Flux<Message> getBranchMessages(String sessionId, String branchId) {
        return retry.withRetry("getBranchMessages", branchManager.getBranchMessages(sessionId, branchId));
    }

    public Mono<Integer> cleanupBranches(String sessionId, BranchCleanupOptions options) {
        return retry.withRetry("cleanupBranches", branchManager.cleanupBranches(sessionId, options));
    }

    /** Archives a message that reached the store through another path (e.g. a streamed reply). */
    public void mirrorToArchive(Message message) {
        mirror("upsert " + message.getId(), archivalSink.upsertMessage(message));
    }

    /** Fire-and-forget archive write; failures are logged, never surfaced. */
    private void mirror(String what, Mono<Void> archiveWrite) {
        if (!archivalSink.isEnabled()) {
            return;
        }
        archiveWrite.subscribe(
                v -> { },
                e -> log.warn("[Archive] {} failed: {}", what, e.toString()));
    }
}
