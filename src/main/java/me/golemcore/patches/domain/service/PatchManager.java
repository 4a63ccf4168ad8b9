package me.golemcore.patches.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.domain.diff.DiffCodec;
import me.golemcore.patches.domain.diff.PatchApplier;
import me.golemcore.patches.domain.model.ClearResult;
import me.golemcore.patches.domain.model.DiffStats;
import me.golemcore.patches.domain.model.IntegrityReport;
import me.golemcore.patches.domain.model.PatchApplyResult;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.domain.model.PatchOperations;
import me.golemcore.patches.domain.model.PatchStats;
import me.golemcore.patches.domain.model.UndoFileEntry;
import me.golemcore.patches.domain.model.UndoPreview;
import me.golemcore.patches.domain.model.UndoResult;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.inbound.UndoPort;
import me.golemcore.patches.port.outbound.ActiveSessionPort;
import me.golemcore.patches.port.outbound.StoragePort;
import me.golemcore.patches.port.outbound.WorkspaceFilePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Undo history of the active session.
 *
 * <p>
 * Capture turns a file mutation into a numbered patch document plus an index
 * entry. Undo reads entries back, reverse-applies their diffs to the files and
 * drops the entries once the whole batch succeeded. Previews run the same diff
 * logic in memory only.
 *
 * <p>
 * All work runs on the session write queue, one task at a time per session.
 * Retention enforcement after a capture is queued as a separate task; use
 * {@link #awaitPendingTasks()} to wait for it.
 *
 * <p>
 * Without an active session capture answers {@code null}, undo reports
 * "nothing to undo" and previews are empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatchManager implements UndoPort {

    static final String NO_SESSION_KEY = "__no_session__";
    static final String NOTHING_TO_UNDO = "No operations to undo";

    private final ActiveSessionPort activeSessionPort;
    private final PatchIndex patchIndex;
    private final PatchFileStore fileStore;
    private final PatchIntegrityService integrityService;
    private final RetentionPolicy retentionPolicy;
    private final DiffCodec diffCodec;
    private final PatchApplier patchApplier;
    private final WorkspaceFilePort workspaceFilePort;
    private final StoragePort storagePort;
    private final SessionWriteQueue writeQueue;
    private final PatchProperties properties;
    private final Clock clock;

    private volatile String sessionId;

    // ==================== SESSION ====================

    @Override
    public CompletableFuture<Void> onSessionChange() {
        return writeQueue.submit(queueKey(), () -> {
            String next = activeSessionPort.getActiveSessionId().orElse(null);
            String previous = sessionId;
            sessionId = next;
            fileStore.bindSession(next);
            patchIndex.bindSession(next);
            if (next == null) {
                log.info("[Patches] No active session, undo history disabled");
                return null;
            }
            try {
                fileStore.ensureDirectory();
                patchIndex.load();
                IntegrityReport report = integrityService.validate(next);
                log.info("[Patches] Session switched {} -> {}: {} patches, next #{}{}",
                        previous, next, patchIndex.count(), patchIndex.nextNumber(),
                        report.isClean() ? "" : " (integrity issues quarantined)");
            } catch (RuntimeException e) { // NOSONAR - session switch must not fail the host
                log.error("[Patches] Failed to initialize patches for session {}: {}", next, e.getMessage(), e);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> cleanupSession(String targetSessionId) {
        if (targetSessionId == null || targetSessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return writeQueue.submit(targetSessionId, () -> {
            String directory = targetSessionId + "/" + properties.getStorage().getPatchesDirectory();
            try {
                storagePort.deleteDirectory(directory).join();
                if (targetSessionId.equals(sessionId)) {
                    patchIndex.clear();
                }
                log.info("[Patches] Removed patch history of session {}", targetSessionId);
            } catch (RuntimeException e) { // NOSONAR - best-effort cleanup
                log.warn("[Patches] Failed to remove patch history of session {}: {}",
                        targetSessionId, e.getMessage());
            }
            return null;
        });
    }

    /**
     * Completes when every task queued for the active session, including
     * follow-up retention, has finished.
     */
    public CompletableFuture<Void> awaitPendingTasks() {
        return writeQueue.drain(queueKey());
    }

    public String getSessionId() {
        return sessionId;
    }

    // ==================== CAPTURE ====================

    @Override
    public CompletableFuture<Integer> capture(String operationType, String filePath, String originalContent,
            String newContent) {
        if (operationType == null || operationType.isBlank()) {
            throw new IllegalArgumentException("operationType must not be blank");
        }
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("filePath must not be blank");
        }
        String key = queueKey();
        return writeQueue.submit(key, () -> doCapture(key, operationType, filePath,
                originalContent == null ? "" : originalContent,
                newContent == null ? "" : newContent));
    }

    private Integer doCapture(String key, String operationType, String filePath, String originalContent,
            String newContent) {
        String session = sessionId;
        if (session == null) {
            return null;
        }
        Integer patchNumber = null;
        String patchFile = null;
        boolean indexed = false;
        try {
            String absolutePath = canonicalPath(filePath);
            String target = PatchOperations.DELETE.equals(operationType) ? "" : newContent;
            String timestamp = clock.instant().toString();
            String diff = diffCodec.buildDiff(originalContent, target, displayName(absolutePath));
            String document = diffCodec.wrap(operationType, absolutePath, timestamp, diff);

            fileStore.ensureDirectory();
            int candidate = freePatchNumber();
            patchFile = fileStore.write(candidate, document).orElse(null);
            if (patchFile == null) {
                return null;
            }
            patchNumber = candidate;
            patchIndex.add(PatchMetadata.builder()
                    .patchNumber(patchNumber)
                    .timestamp(timestamp)
                    .operationType(operationType)
                    .filePath(absolutePath)
                    .patchFile(patchFile)
                    .build());
            indexed = true;
            patchIndex.incrementNumber();
            patchIndex.save();
            log.info("[Patches] Captured {} on {} as patch #{}", operationType, absolutePath, patchNumber);
        } catch (RuntimeException e) { // NOSONAR - capture must never fail the file operation
            log.error("[Patches] Failed to capture {} on {}: {}", operationType, filePath, e.getMessage(), e);
            rollbackCapture(indexed ? patchNumber : null, patchFile);
            return null;
        }

        writeQueue.submit(key, () -> {
            enforceRetention(session);
            return null;
        });
        return patchNumber;
    }

    /**
     * Next patch number whose entry and document are both unused. Numbers
     * held by an entry or a stray document are skipped, never overwritten.
     */
    private int freePatchNumber() {
        int candidate = patchIndex.nextNumber();
        while (patchIndex.get(candidate).isPresent() || fileStore.exists(fileStore.filenameFor(candidate))) {
            log.warn("[Patches] Patch #{} is already taken, skipping", candidate);
            candidate = patchIndex.incrementNumber();
        }
        return candidate;
    }

    /**
     * Remove what a failed capture added: its own index entry when it got
     * that far, and the document it wrote.
     */
    private void rollbackCapture(Integer indexedNumber, String writtenFile) {
        if (indexedNumber != null) {
            patchIndex.remove(indexedNumber);
        }
        if (writtenFile != null) {
            fileStore.delete(writtenFile);
        }
    }

    private void enforceRetention(String session) {
        if (!Objects.equals(session, sessionId)) {
            return;
        }
        try {
            retentionPolicy.enforce();
            Duration maxAge = properties.getRetention().getMaxAge();
            if (maxAge != null) {
                retentionPolicy.enforceMaxAge(maxAge);
            }
        } catch (RuntimeException e) { // NOSONAR - retention is retried after the next capture
            log.error("[Retention] Failed to enforce limits for session {}: {}", session, e.getMessage(), e);
        }
    }

    // ==================== UNDO ====================

    @Override
    public CompletableFuture<UndoResult> undoLast(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        return writeQueue.submit(queueKey(), () -> {
            if (patchIndex.count() == 0) {
                return UndoResult.failure(NOTHING_TO_UNDO);
            }
            List<PatchMetadata> batch = patchIndex.last(count);
            if (batch.size() < count) {
                log.warn("[Undo] Only {} operations available to undo ({} requested)", batch.size(), count);
            }
            return undoBatch(batch);
        });
    }

    @Override
    public CompletableFuture<UndoResult> undoSingle(int patchNumber) {
        if (patchNumber <= 0) {
            throw new IllegalArgumentException("patchNumber must be positive: " + patchNumber);
        }
        return writeQueue.submit(queueKey(), () -> {
            Optional<PatchMetadata> patch = patchIndex.get(patchNumber);
            if (patch.isEmpty()) {
                return UndoResult.failure("Patch " + patchNumber + " not found");
            }
            return undoBatch(List.of(patch.get()));
        });
    }

    @Override
    public CompletableFuture<UndoResult> undoSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("since must not be null");
        }
        return writeQueue.submit(queueKey(), () -> {
            if (patchIndex.count() == 0) {
                return UndoResult.failure(NOTHING_TO_UNDO);
            }
            List<PatchMetadata> batch = patchIndex.since(since);
            if (batch.isEmpty()) {
                return UndoResult.failure("No operations since " + since);
            }
            return undoBatch(batch);
        });
    }

    @Override
    public CompletableFuture<UndoResult> undoSince(String since) {
        return undoSince(parseInstant(since));
    }

    /**
     * Revert entries newest first. Entries and their documents are dropped
     * only when every revert succeeded; otherwise the index is left as is.
     */
    private UndoResult undoBatch(List<PatchMetadata> batch) {
        List<String> revertedFiles = new ArrayList<>();
        List<String> failedOperations = new ArrayList<>();

        for (int i = batch.size() - 1; i >= 0; i--) {
            PatchMetadata patch = batch.get(i);
            if (reverseApply(patch)) {
                revertedFiles.add(patch.getFilePath());
                log.info("[Undo] Reverted {} on {} (patch #{})",
                        patch.getOperationType(), patch.getFilePath(), patch.getPatchNumber());
            } else {
                String message = "Failed to revert " + patch.getOperationType() + " on " + patch.getFilePath();
                failedOperations.add(message);
                log.error("[Undo] {} (patch #{})", message, patch.getPatchNumber());
            }
        }

        if (failedOperations.isEmpty()) {
            try {
                patchIndex.removeMany(batch.stream().map(PatchMetadata::getPatchNumber).toList());
                patchIndex.save();
                batch.forEach(p -> fileStore.delete(p.getPatchFile()));
            } catch (RuntimeException e) { // NOSONAR - files are reverted, index will be reconciled
                log.error("[Undo] Reverted {} files but failed to update the index: {}",
                        revertedFiles.size(), e.getMessage(), e);
                failedOperations.add("Failed to update patch index: " + e.getMessage());
            }
        } else if (!revertedFiles.isEmpty()) {
            log.warn("[Undo] Batch partially reverted ({} of {}), index entries kept",
                    revertedFiles.size(), batch.size());
        }

        UndoResult result = UndoResult.of(revertedFiles, failedOperations);
        if (!result.isValid()) {
            log.error("[Undo] Generated invalid undo result: {}", result);
            return UndoResult.failure(UndoResult.INVALID_STRUCTURE);
        }
        return result;
    }

    /**
     * Reverse-apply one patch to its file. An empty result removes the file
     * when it exists, which reverts a creation.
     *
     * @return false on any failure; the file is then left untouched
     */
    boolean reverseApply(PatchMetadata patch) {
        Optional<String> diff = readDiff(patch);
        if (diff.isEmpty()) {
            return false;
        }
        try {
            Path file = Paths.get(patch.getFilePath());
            boolean existed = workspaceFilePort.exists(file);
            String current = workspaceFilePort.readText(file).orElse("");

            PatchApplyResult applied = patchApplier.apply(diff.get(), current, true);
            if (!applied.isSuccess()) {
                log.error("[Undo] Patch #{} does not apply to {}: {}",
                        patch.getPatchNumber(), patch.getFilePath(), applied.getError());
                return false;
            }

            String content = applied.getContent();
            if (!content.isEmpty()) {
                workspaceFilePort.writeTextAtomic(file, content);
                log.debug("[Undo] Rewrote {}", file);
            } else if (existed) {
                workspaceFilePort.delete(file);
                log.debug("[Undo] Removed {}", file);
            }
            return true;
        } catch (IOException | InvalidPathException e) {
            log.error("[Undo] Failed to revert patch #{} on {}: {}",
                    patch.getPatchNumber(), patch.getFilePath(), e.getMessage());
            return false;
        }
    }

    // ==================== PREVIEW ====================

    @Override
    public CompletableFuture<List<UndoPreview>> previewLast(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        return writeQueue.submit(queueKey(), () -> previewBatch(patchIndex.last(count)));
    }

    @Override
    public CompletableFuture<UndoPreview> previewSingle(int patchNumber) {
        if (patchNumber <= 0) {
            throw new IllegalArgumentException("patchNumber must be positive: " + patchNumber);
        }
        return writeQueue.submit(queueKey(), () -> patchIndex.get(patchNumber)
                .flatMap(patch -> preview(patch, new HashMap<>()))
                .orElse(null));
    }

    @Override
    public CompletableFuture<List<UndoPreview>> previewSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("since must not be null");
        }
        return writeQueue.submit(queueKey(), () -> previewBatch(patchIndex.since(since)));
    }

    @Override
    public CompletableFuture<List<UndoPreview>> previewSince(String since) {
        return previewSince(parseInstant(since));
    }

    /**
     * Previews newest first. Several patches on one file are simulated against
     * each other's predicted content, as the undo would apply them.
     */
    private List<UndoPreview> previewBatch(List<PatchMetadata> batch) {
        if (batch.isEmpty()) {
            return null; // NOSONAR - null means nothing to preview
        }
        Map<String, String> predictedByFile = new HashMap<>();
        List<UndoPreview> previews = new ArrayList<>();
        for (int i = batch.size() - 1; i >= 0; i--) {
            preview(batch.get(i), predictedByFile).ifPresent(previews::add);
        }
        return previews.isEmpty() ? null : previews; // NOSONAR
    }

    private Optional<UndoPreview> preview(PatchMetadata patch, Map<String, String> predictedByFile) {
        try {
            String current = predictedByFile.get(patch.getFilePath());
            if (current == null) {
                current = workspaceFilePort.readText(Paths.get(patch.getFilePath())).orElse("");
            }
            Optional<String> diff = readDiff(patch);
            if (diff.isEmpty()) {
                return Optional.empty();
            }
            Optional<String> predicted = patchApplier.simulate(diff.get(), current, true);
            if (predicted.isEmpty()) {
                log.warn("[Undo] Patch #{} cannot be previewed against current {}",
                        patch.getPatchNumber(), patch.getFilePath());
                return Optional.empty();
            }
            predictedByFile.put(patch.getFilePath(), predicted.get());
            return Optional.of(UndoPreview.builder()
                    .operationType(patch.getOperationType())
                    .filePath(patch.getFilePath())
                    .patchNumber(patch.getPatchNumber())
                    .timestamp(patch.getTimestamp())
                    .currentContent(current)
                    .predictedContent(predicted.get())
                    .build());
        } catch (IOException | InvalidPathException e) {
            log.warn("[Undo] Could not read {} for preview: {}", patch.getFilePath(), e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== REPORTING ====================

    @Override
    public CompletableFuture<List<UndoFileEntry>> recentFileList(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return writeQueue.submit(queueKey(), () -> {
            List<UndoFileEntry> entries = new ArrayList<>();
            for (PatchMetadata patch : patchIndex.history(limit)) {
                Optional<String> document = fileStore.read(patch.getPatchFile());
                if (document.isEmpty()) {
                    log.warn("[Undo] Failed to read patch #{}, skipping", patch.getPatchNumber());
                    continue;
                }
                DiffStats stats = diffCodec.unwrap(document.get())
                        .map(diffCodec::stats)
                        .orElse(DiffStats.EMPTY);
                entries.add(UndoFileEntry.builder()
                        .patchNumber(patch.getPatchNumber())
                        .filePath(patch.getFilePath())
                        .operationType(patch.getOperationType())
                        .timestamp(patch.getTimestamp())
                        .stats(stats)
                        .build());
            }
            return entries;
        });
    }

    @Override
    public CompletableFuture<PatchStats> stats() {
        return writeQueue.submit(queueKey(), () -> {
            if (!fileStore.isBound()) {
                return PatchStats.empty();
            }
            return PatchStats.builder()
                    .patchesDirectory(fileStore.getDirectory())
                    .totalPatches(patchIndex.count())
                    .operationCounts(patchIndex.operationCounts())
                    .totalSizeBytes(fileStore.totalSize())
                    .nextPatchNumber(patchIndex.nextNumber())
                    .build();
        });
    }

    @Override
    public CompletableFuture<List<PatchMetadata>> history(Integer limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        Integer effective = limit != null && limit == 0 ? null : limit;
        return writeQueue.submit(queueKey(), () -> patchIndex.history(effective));
    }

    @Override
    public CompletableFuture<ClearResult> clearAll() {
        return writeQueue.submit(queueKey(), () -> {
            if (!fileStore.isBound()) {
                return ClearResult.builder()
                        .success(false)
                        .message("No active session")
                        .build();
            }
            try {
                int removed = 0;
                for (PatchMetadata patch : patchIndex.all()) {
                    if (fileStore.delete(patch.getPatchFile())) {
                        removed++;
                    } else {
                        log.warn("[Patches] Failed to remove patch file {}", patch.getPatchFile());
                    }
                }
                patchIndex.clear();
                patchIndex.save();
                log.info("[Patches] Cleared patch history: removed {} patch files", removed);
                return ClearResult.builder()
                        .success(true)
                        .message("Cleared " + removed + " patches from history")
                        .removedCount(removed)
                        .build();
            } catch (RuntimeException e) { // NOSONAR - reported to the caller
                log.error("[Patches] Failed to clear patch history: {}", e.getMessage(), e);
                return ClearResult.builder()
                        .success(false)
                        .message("Failed to clear patch history: " + e.getMessage())
                        .build();
            }
        });
    }

    // ==================== RETENTION ====================

    @Override
    public CompletableFuture<List<PatchMetadata>> updateRetentionLimits(Integer maxPatches, Long maxSizeBytes) {
        RetentionPolicy.checkLimits(maxPatches, maxSizeBytes);
        return writeQueue.submit(queueKey(), () -> {
            retentionPolicy.updateLimits(maxPatches, maxSizeBytes);
            if (!fileStore.isBound()) {
                return List.<PatchMetadata>of();
            }
            return retentionPolicy.enforce();
        });
    }

    @Override
    public CompletableFuture<List<PatchMetadata>> enforceMaxAge(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be a non-negative duration: " + maxAge);
        }
        return writeQueue.submit(queueKey(), () -> {
            if (!fileStore.isBound()) {
                return List.<PatchMetadata>of();
            }
            return retentionPolicy.enforceMaxAge(maxAge);
        });
    }

    @Override
    public CompletableFuture<Boolean> updatePatch(int patchNumber, PatchMetadata changes) {
        if (patchNumber <= 0) {
            throw new IllegalArgumentException("patchNumber must be positive: " + patchNumber);
        }
        if (changes == null) {
            throw new IllegalArgumentException("changes must not be null");
        }
        return writeQueue.submit(queueKey(), () -> {
            if (!patchIndex.update(patchNumber, changes)) {
                log.warn("[Patches] Patch #{} not updated: unknown or invalid change", patchNumber);
                return false;
            }
            try {
                patchIndex.save();
                log.info("[Patches] Updated metadata of patch #{}", patchNumber);
                return true;
            } catch (RuntimeException e) { // NOSONAR - reported to the caller
                log.error("[Patches] Failed to save metadata of patch #{}: {}", patchNumber, e.getMessage(), e);
                return false;
            }
        });
    }

    // ==================== HELPERS ====================

    private Optional<String> readDiff(PatchMetadata patch) {
        Optional<String> document = fileStore.read(patch.getPatchFile());
        if (document.isEmpty()) {
            log.error("[Undo] Patch file not found: {}", patch.getPatchFile());
            return Optional.empty();
        }
        Optional<String> diff = diffCodec.unwrap(document.get());
        if (diff.isEmpty()) {
            log.error("[Undo] No diff content in patch file {}", patch.getPatchFile());
        }
        return diff;
    }

    private String queueKey() {
        String current = sessionId;
        return current != null ? current : NO_SESSION_KEY;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("timestamp must not be blank");
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value, e);
        }
    }

    private static String canonicalPath(String filePath) {
        return Paths.get(filePath).toAbsolutePath().normalize().toString();
    }

    private static String displayName(String absolutePath) {
        Path fileName = Paths.get(absolutePath).getFileName();
        return fileName != null ? fileName.toString() : absolutePath;
    }
}
