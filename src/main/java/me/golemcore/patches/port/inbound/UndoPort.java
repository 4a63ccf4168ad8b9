package me.golemcore.patches.port.inbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.patches.domain.model.ClearResult;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.domain.model.PatchStats;
import me.golemcore.patches.domain.model.UndoFileEntry;
import me.golemcore.patches.domain.model.UndoPreview;
import me.golemcore.patches.domain.model.UndoResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Undo history of the active session, as seen by the tools that mutate files
 * and by the user-facing undo commands.
 *
 * <p>
 * Every call is serialized with the other calls for the same session. Argument
 * errors are thrown synchronously as {@link IllegalArgumentException}; I/O
 * failures are reported in the returned values and never complete the future
 * exceptionally.
 */
public interface UndoPort {

    /**
     * Record a file mutation that already happened.
     *
     * @param operationType
     *            e.g. {@code write}, {@code edit}, {@code delete}
     * @param filePath
     *            path of the affected file
     * @param originalContent
     *            content before the mutation, {@code ""} for new files
     * @param newContent
     *            content after the mutation, ignored for {@code delete}
     * @return the assigned patch number, or {@code null} without a session or
     *         when capture failed
     */
    CompletableFuture<Integer> capture(String operationType, String filePath, String originalContent,
            String newContent);

    CompletableFuture<UndoResult> undoLast(int count);

    CompletableFuture<UndoResult> undoSingle(int patchNumber);

    CompletableFuture<UndoResult> undoSince(Instant since);

    /**
     * @param since
     *            ISO-8601 instant, e.g. {@code 2026-01-01T10:00:00Z}
     */
    CompletableFuture<UndoResult> undoSince(String since);

    /**
     * @return previews, or {@code null} when there is nothing to preview
     */
    CompletableFuture<List<UndoPreview>> previewLast(int count);

    /**
     * @return the preview, or {@code null} when the patch is unknown or cannot
     *         be simulated
     */
    CompletableFuture<UndoPreview> previewSingle(int patchNumber);

    CompletableFuture<List<UndoPreview>> previewSince(Instant since);

    /**
     * @param since
     *            ISO-8601 instant, e.g. {@code 2026-01-01T10:00:00Z}
     */
    CompletableFuture<List<UndoPreview>> previewSince(String since);

    CompletableFuture<List<UndoFileEntry>> recentFileList(int limit);

    CompletableFuture<PatchStats> stats();

    CompletableFuture<List<PatchMetadata>> history(Integer limit);

    CompletableFuture<ClearResult> clearAll();

    /**
     * Replace the retention limits and evict what no longer fits. Null keeps
     * the current value.
     *
     * @return evicted entries, oldest first
     */
    CompletableFuture<List<PatchMetadata>> updateRetentionLimits(Integer maxPatches, Long maxSizeBytes);

    /**
     * Evict patches older than {@code maxAge}.
     *
     * @return evicted entries, oldest first
     */
    CompletableFuture<List<PatchMetadata>> enforceMaxAge(Duration maxAge);

    /**
     * Change operation type, file path or timestamp of a patch. Null fields of
     * {@code changes} are kept.
     *
     * @return false when the patch is unknown or the change is invalid
     */
    CompletableFuture<Boolean> updatePatch(int patchNumber, PatchMetadata changes);

    /**
     * Re-read the active session id, reload its index and reconcile it with
     * the files on disk.
     */
    CompletableFuture<Void> onSessionChange();

    /**
     * Delete a session's patch directory. Best-effort.
     */
    CompletableFuture<Void> cleanupSession(String sessionId);
}
