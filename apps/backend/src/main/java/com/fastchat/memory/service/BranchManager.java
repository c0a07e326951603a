package com.fastchat.memory.service;

import com.fastchat.memory.api.dto.Branch;
import com.fastchat.memory.api.dto.BranchCleanupOptions;
import com.fastchat.memory.api.dto.BranchHistoryEntry;
import com.fastchat.memory.api.dto.BranchOptions;
import com.fastchat.memory.api.dto.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Branch lifecycle: created (inactive) -> active <-> inactive -> archived -> deleted.
 * The main timeline is implicit and has no branch record.
 *
 * <p>Deterministic failures surface as {@link com.fastchat.memory.exception.BranchException}.
 * Every state change appends exactly one {@link BranchHistoryEntry}.</p>
 */
public interface BranchManager {

    Mono<Branch> createBranch(String sessionId, String originMessageId, BranchOptions options);

    /** Empty when the session records no branches. */
    Flux<Branch> getBranches(String sessionId, boolean includeArchived);

    Mono<Branch> getBranch(String branchId);

    /** Activates {@code branchId} and deactivates whatever was active before. */
    Mono<Branch> switchBranch(String sessionId, String branchId);

    /** Deactivates every branch so the main timeline is active again. */
    Mono<Void> switchToMain(String sessionId);

    /**
     * Copies the source branch's messages into the target's index with their original timestamps.
     * Repeating a merge does not duplicate messages.
     *
     * @return the updated target branch
     */
    Mono<Branch> mergeBranches(String sessionId, String sourceBranchId, String targetBranchId);

    /** Stores a new version; the edited message itself is left untouched. */
    Mono<Message> editMessage(String messageId, String newContent);

    /** Root message first, then each edit, oldest to newest. */
    Flux<Message> getMessageVersions(String messageId);

    Mono<Branch> archiveBranch(String sessionId, String branchId);

    Mono<Void> deleteBranch(String sessionId, String branchId, boolean deleteMessages);

    Flux<BranchHistoryEntry> getBranchHistory(String sessionId);

    /** Messages appended directly to the branch, oldest first. */
    Flux<Message> getBranchMessages(String sessionId, String branchId);

    /**
     * Archives branches beyond the keep-limit that are older than the cutoff.
     *
     * @return number of branches archived
     */
    Mono<Integer> cleanupBranches(String sessionId, BranchCleanupOptions options);
}
