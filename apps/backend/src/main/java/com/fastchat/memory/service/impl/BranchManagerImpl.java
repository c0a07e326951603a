package com.fastchat.memory.service.impl;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchAction;
import com.fastchat.memory.api.dto.BranchCleanupOptions;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.BranchOptions;
import com.fastchat.memory.api.dto.Message;
import com.fastchat.memory.api.dto.MessageRange;
import com.fastchat.memory.api.dto.Session;
import com.fastchat.memory.config.MemoryProperties;
import com.fastchat.memory.exception.BranchException;
import com.fastchat.memory.service.BranchManager;
import com.fastchat.memory.service.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Slf4j
@Service
@RequiredArgsConstructor
public class BranchManagerImpl implements BranchManager {

    static final String META_MERGES = "merges";

    private final MemoryStore store;
    private final MemoryProperties props;
    private final Clock clock;

    // ---------------------------------------------------------------- create / read

    @Override
    public Mono<Branch> createBranch(String sessionId, String originMessageId, BranchOptions options) {
        BranchOptions opts = options == null ? BranchOptions.none() : options;
        return store.getMessage(originMessageId)
                .switchIfEmpty(Mono.error(() -> BranchException.originMessageNotFound(originMessageId)))
                .flatMap(origin -> {
                    if (!sessionId.equals(origin.getSessionId())) {
                        return Mono.error(new BranchException("Origin message does not belong to this session",
                                detailsOf("sessionId", sessionId, "originMessageId", originMessageId)));
                    }
                    Mono<Integer> parentDepth = origin.branch()
                            .map(parentId -> store.getBranch(parentId).map(Branch::getDepth).defaultIfEmpty(0))
                            .orElseGet(() -> Mono.just(0));
                    return parentDepth.flatMap(depth -> {
                        long now = clock.millis();
                        String name = opts.name() == null || opts.name().isBlank()
                                ? "Branch at " + Instant.ofEpochMilli(now)
                                : opts.name();
                        Branch branch = Branch.builder()
                                .id(UUID.randomUUID().toString())
                                .name(name)
                                .sessionId(sessionId)
                                .parentBranchId(origin.getBranchId())
                                .originMessageId(originMessageId)
                                .createdAt(now)
                                .depth(depth + 1)
                                .active(false)
                                .archived(false)
                                .metadata(opts.metadata() == null ? Map.of() : opts.metadata())
                                .build();
                        return store.saveBranch(branch)
                                .then(mutateSession(sessionId, s -> s.withBranch(branch.getId())))
                                .then(record(sessionId, branch.getId(), BranchAction.CREATE, detailsOf(
                                        "name", name,
                                        "originMessageId", originMessageId,
                                        "parentBranchId", branch.getParentBranchId())))
                                .doOnSuccess(v -> log.debug("[Branch] created sessionId={} branchId={} origin={} parent={}",
                                        sessionId, branch.getId(), originMessageId, branch.getParentBranchId()))
                                .thenReturn(branch);
                    });
                });
    }

    @Override
    public Flux<Branch> getBranches(String sessionId, boolean includeArchived) {
        return store.getSession(sessionId)
                .flatMapIterable(Session::getBranches)
                .concatMap(store::getBranch)
                .filter(b -> includeArchived || !b.isArchived());
    }

    @Override
    public Mono<Branch> getBranch(String branchId) {
        return store.getBranch(branchId);
    }

    @Override
    public Flux<Message> getBranchMessages(String sessionId, String branchId) {
        return requireOwned(sessionId, branchId)
                .flatMapMany(b -> store.getMessages(sessionId, Optional.of(branchId), MessageRange.all()));
    }

    @Override
    public Flux<BranchHistoryEntry> getBranchHistory(String sessionId) {
        return store.getBranchHistory(sessionId);
    }

    // ---------------------------------------------------------------- switching

    @Override
    public Mono<Branch> switchBranch(String sessionId, String branchId) {
        return store.withSessionLock(sessionId, () -> requireOwned(sessionId, branchId)
                .flatMap(target -> {
                    if (target.isArchived()) {
                        return Mono.error(new BranchException("Cannot switch to an archived branch",
                                detailsOf("branchId", branchId)));
                    }
                    return store.getSession(sessionId)
                            .switchIfEmpty(Mono.error(() -> BranchException.sessionNotFound(sessionId)))
                            .flatMap(session -> {
                                String previous = session.getActiveBranchId();
                                Branch activated = target.withActive(true);
                                return deactivateAll(session, branchId)
                                        .then(store.saveBranch(activated))
                                        .then(store.setSession(session.toBuilder()
                                                .activeBranchId(branchId)
                                                .lastAccessedAt(clock.millis())
                                                .build()))
                                        .then(record(sessionId, branchId, BranchAction.SWITCH,
                                                detailsOf("previousBranchId", previous)))
                                        .doOnSuccess(v -> log.debug("[Branch] switched sessionId={} from={} to={}",
                                                sessionId, previous, branchId))
                                        .thenReturn(activated);
                            });
                }));
    }

    @Override
    public Mono<Void> switchToMain(String sessionId) {
        return store.withSessionLock(sessionId, () -> store.getSession(sessionId)
                .switchIfEmpty(Mono.error(() -> BranchException.sessionNotFound(sessionId)))
                .flatMap(session -> deactivateAll(session, null)
                        .then(store.setSession(session.toBuilder()
                                .activeBranchId(null)
                                .lastAccessedAt(clock.millis())
                                .build()))
                        .then(record(sessionId, null, BranchAction.SWITCH,
                                detailsOf("previousBranchId", session.getActiveBranchId())))));
    }

    /** Clears the active flag on every branch of the session except {@code keep}. */
    private Mono<Void> deactivateAll(Session session, String keep) {
        return Flux.fromIterable(session.getBranches())
                .filter(id -> !id.equals(keep))
                .concatMap(store::getBranch)
                .filter(Branch::isActive)
                .concatMap(b -> store.saveBranch(b.withActive(false)))
                .then();
    }

    // ---------------------------------------------------------------- merge

    @Override
    public Mono<Branch> mergeBranches(String sessionId, String sourceBranchId, String targetBranchId) {
        if (sourceBranchId.equals(targetBranchId)) {
            return Mono.error(new BranchException("Cannot merge a branch into itself",
                    detailsOf("branchId", sourceBranchId)));
        }
        return Mono.zip(requireOwned(sessionId, sourceBranchId), requireOwned(sessionId, targetBranchId))
                .flatMap(pair -> {
                    Branch source = pair.getT1();
                    Branch target = pair.getT2();
                    if (source.isArchived() || target.isArchived()) {
                        return Mono.error(new BranchException("Cannot merge archived branches",
                                detailsOf("sourceBranchId", sourceBranchId, "targetBranchId", targetBranchId)));
                    }
                    return store.getMessages(sessionId, Optional.of(sourceBranchId), MessageRange.all())
                            .map(m -> mergedCopy(m, sourceBranchId, targetBranchId))
                            .concatMap(copy -> store.addMessage(copy).thenReturn(copy))
                            .count()
                            .flatMap(copied -> finishMerge(sessionId, source, target, copied));
                });
    }

    /**
     * Copying runs unlocked; the bookkeeping re-reads both records under the session lock so a
     * switch or archive that happened meanwhile is not overwritten.
     */
    private Mono<Branch> finishMerge(String sessionId, Branch source, Branch target, long copied) {
        boolean archiveSource = props.getBranch().getMergePolicy() == MemoryProperties.MergePolicy.ARCHIVE_SOURCE;
        return store.withSessionLock(sessionId, () -> Mono.zip(
                        requireOwned(sessionId, source.getId()),
                        requireOwned(sessionId, target.getId()))
                .flatMap(fresh -> {
                    Branch currentSource = fresh.getT1();
                    Branch updated = withMergeRecorded(fresh.getT2(), source.getId(), copied);
                    Mono<Void> sourceUpdate = archiveSource && !currentSource.isArchived()
                            ? store.saveBranch(currentSource.withArchived(true))
                            : Mono.empty();
                    return store.saveBranch(updated)
                            .then(sourceUpdate)
                            .then(record(sessionId, target.getId(), BranchAction.MERGE, detailsOf(
                                    "sourceBranchId", source.getId(),
                                    "messageCount", copied,
                                    "sourceArchived", archiveSource)))
                            .thenReturn(updated);
                }))
                .doOnSuccess(b -> log.debug("[Branch] merged sessionId={} source={} target={} messages={}",
                        sessionId, source.getId(), target.getId(), copied));
    }

    private Branch withMergeRecorded(Branch target, String sourceBranchId, long copied) {
        Map<String, Object> mergeInfo = new LinkedHashMap<>();
        mergeInfo.put("sourceBranchId", sourceBranchId);
        mergeInfo.put("mergedAt", clock.millis());
        mergeInfo.put("messageCount", copied);
        List<Object> merges = new ArrayList<>();
        if (target.getMetadata() != null && target.getMetadata().get(META_MERGES) instanceof List<?> existing) {
            merges.addAll(existing);
        }
        merges.add(mergeInfo);
        return target.withMetadata(META_MERGES, List.copyOf(merges));
    }

    private static Message mergedCopy(Message original, String sourceBranchId, String targetBranchId) {
        String id = UUID.nameUUIDFromBytes((targetBranchId + ":" + original.getId()).getBytes(StandardCharsets.UTF_8))
                .toString();
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(Message.META_MERGED_FROM, sourceBranchId);
        extra.put(Message.META_ORIGINAL_MESSAGE_ID, original.getId());
        return original.toBuilder()
                .id(id)
                .branchId(targetBranchId)
                .build()
                .withMetadata(extra);
    }

    // ---------------------------------------------------------------- edits

    @Override
    public Mono<Message> editMessage(String messageId, String newContent) {
        return store.getMessage(messageId)
                .switchIfEmpty(Mono.error(() -> BranchException.messageNotFound(messageId)))
                .flatMap(original -> {
                    String rootId = original.rootMessageId();
                    Map<String, Object> extra = new LinkedHashMap<>();
                    extra.put(Message.META_EDITED, true);
                    extra.put(Message.META_ORIGINAL_MESSAGE_ID, original.getId());
                    extra.put(Message.META_ORIGINAL_CONTENT, original.getContent());
                    extra.put(Message.META_ROOT_MESSAGE_ID, rootId);
                    Map<String, Object> base = original.getMetadata() == null
                            ? new LinkedHashMap<>()
                            : new LinkedHashMap<>(original.getMetadata());
                    // a stale estimate would misprice the new content
                    base.remove(Message.META_TOKENS);
                    Message edited = original.toBuilder()
                            .id(UUID.randomUUID().toString())
                            .content(newContent)
                            .timestamp(clock.millis())
                            .version(original.getVersion() + 1)
                            .metadata(base)
                            .build()
                            .withMetadata(extra);
                    return ensureRootVersion(rootId)
                            .then(store.addMessage(edited))
                            .then(store.addMessageVersion(rootId, edited.getId()))
                            .then(record(original.getSessionId(), original.getBranchId(), BranchAction.EDIT, detailsOf(
                                    "messageId", original.getId(),
                                    "newMessageId", edited.getId(),
                                    "version", edited.getVersion())))
                            .doOnSuccess(v -> log.debug("[Branch] edited messageId={} newMessageId={} version={}",
                                    original.getId(), edited.getId(), edited.getVersion()))
                            .thenReturn(edited);
                });
    }

    private Mono<Void> ensureRootVersion(String rootId) {
        return store.getMessageVersionIds(rootId)
                .hasElements()
                .flatMap(has -> has ? Mono.<Void>empty() : store.addMessageVersion(rootId, rootId));
    }

    @Override
    public Flux<Message> getMessageVersions(String messageId) {
        return store.getMessage(messageId)
                .map(Message::rootMessageId)
                .defaultIfEmpty(messageId)
                .flatMapMany(rootId -> store.getMessageVersionIds(rootId)
                        .switchIfEmpty(Flux.just(rootId)))
                .concatMap(store::getMessage);
    }

    // ---------------------------------------------------------------- archive / delete / cleanup

    @Override
    public Mono<Branch> archiveBranch(String sessionId, String branchId) {
        return store.withSessionLock(sessionId, () -> requireOwned(sessionId, branchId)
                .flatMap(branch -> branch.isArchived() ? Mono.just(branch) : archiveLocked(branch)));
    }

    /** Caller holds the session lock and passes a record read under it. */
    private Mono<Branch> archiveLocked(Branch branch) {
        Branch archived = branch.withArchived(true);
        return store.saveBranch(archived)
                .then(record(branch.getSessionId(), branch.getId(), BranchAction.ARCHIVE,
                        detailsOf("active", branch.isActive())))
                .doOnSuccess(v -> log.debug("[Branch] archived sessionId={} branchId={}",
                        branch.getSessionId(), branch.getId()))
                .thenReturn(archived);
    }

    @Override
    public Mono<Void> deleteBranch(String sessionId, String branchId, boolean deleteMessages) {
        return requireOwned(sessionId, branchId).flatMap(branch -> {
            Mono<Long> purge = deleteMessages
                    ? store.getMessages(sessionId, Optional.of(branchId), MessageRange.all())
                            .concatMap(m -> store.deleteMessage(m.getId()).thenReturn(m))
                            .count()
                    : Mono.just(0L);
            return purge.flatMap(removed -> store.deleteBranch(branchId)
                    .then(mutateSession(sessionId, s -> s.withoutBranch(branchId)))
                    .then(record(sessionId, branchId, BranchAction.DELETE, detailsOf(
                            "deleteMessages", deleteMessages,
                            "messagesDeleted", removed)))
                    .doOnSuccess(v -> log.info("[Branch] deleted sessionId={} branchId={} messagesDeleted={}",
                            sessionId, branchId, removed)));
        });
    }

    @Override
    public Mono<Integer> cleanupBranches(String sessionId, BranchCleanupOptions options) {
        BranchCleanupOptions opts = options == null ? BranchCleanupOptions.defaults() : options;
        MemoryProperties.BranchSettings settings = props.getBranch();
        int keep = opts.limit() != null ? opts.limit() : settings.getCleanupKeep();
        Duration olderThan = opts.olderThan() != null ? opts.olderThan() : settings.getCleanupOlderThan();
        long cutoff = clock.millis() - olderThan.toMillis();

        return getBranches(sessionId, true)
                .collectList()
                .flatMap(branches -> {
                    List<Branch> ranked = new ArrayList<>(branches);
                    // active first, then newest first
                    ranked.sort(Comparator.comparing(Branch::isActive).reversed()
                            .thenComparing(Comparator.comparingLong(Branch::getCreatedAt).reversed()));
                    if (ranked.size() <= keep) {
                        return Mono.just(0);
                    }
                    return Flux.fromIterable(ranked.subList(keep, ranked.size()))
                            .filter(b -> !b.isArchived())
                            .filter(b -> !(opts.keepActive() && b.isActive()))
                            .filter(b -> b.getCreatedAt() < cutoff)
                            .concatMap(b -> store.withSessionLock(sessionId, () -> store.getBranch(b.getId())
                                    .filter(fresh -> sessionId.equals(fresh.getSessionId()))
                                    .filter(fresh -> !fresh.isArchived())
                                    .filter(fresh -> !(opts.keepActive() && fresh.isActive()))
                                    .flatMap(this::archiveLocked)))
                            .count()
                            .map(Long::intValue);
                })
                .doOnNext(n -> log.debug("[Branch] cleanup sessionId={} archived={}", sessionId, n));
    }

    // ---------------------------------------------------------------- helpers

    private Mono<Branch> requireOwned(String sessionId, String branchId) {
        return store.getBranch(branchId)
                .switchIfEmpty(Mono.error(() -> BranchException.branchNotFound(branchId)))
                .flatMap(b -> sessionId.equals(b.getSessionId())
                        ? Mono.just(b)
                        : Mono.error(BranchException.wrongSession(sessionId, branchId)));
    }

    /** Read-modify-write of the session record, creating it when the TTL already dropped it. */
    private Mono<Session> mutateSession(String sessionId, UnaryOperator<Session> mutation) {
        return store.withSessionLock(sessionId, () -> {
            long now = clock.millis();
            return store.getSession(sessionId)
                    .defaultIfEmpty(Session.create(sessionId, now))
                    .map(s -> mutation.apply(s).touched(now))
                    .flatMap(s -> store.setSession(s).thenReturn(s));
        });
    }

    private Mono<Void> record(String sessionId, String branchId, BranchAction action, Map<String, Object> details) {
        return Mono.defer(() -> store.appendBranchHistory(
                new BranchHistoryEntry(sessionId, branchId, action, clock.millis(), details)));
    }

    /** Like Map.of but tolerates null values. */
    private static Map<String, Object> detailsOf(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return m;
    }
}
