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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.domain.model.IntegrityReport;
import me.golemcore.patches.domain.model.OrphanManifest;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.domain.model.QuarantineReason;
import me.golemcore.patches.domain.model.QuarantineRecord;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reconciles the patch index with the documents on disk.
 *
 * <p>
 * Index entries without a document are removed from the index and recorded in
 * {@code .quarantine/patches_<session>_<ts>.json}. Documents without an index
 * entry are moved into {@code .quarantine/orphaned_<session>_<ts>/} next to a
 * {@code MANIFEST.json}. Nothing is deleted except leftover {@code *.tmp} files
 * of interrupted writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatchIntegrityService {

    private static final String MANIFEST_FILE = "MANIFEST.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final PatchIndex patchIndex;
    private final PatchFileStore fileStore;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final PatchProperties properties;
    private final Clock clock;

    /**
     * Run a full integrity pass for the bound session. Never throws: failures
     * are logged and whatever was found so far is reported.
     */
    public IntegrityReport validate(String sessionId) {
        IntegrityReport report = IntegrityReport.clean();
        if (sessionId == null || !fileStore.isBound()) {
            return report;
        }
        try {
            removeStaleTempFiles(report);
            quarantineCorruptedEntries(sessionId, report);
            quarantineOrphanedFiles(sessionId, report);
            if (report.isClean()) {
                log.debug("[Integrity] Session {} is consistent ({} patches)", sessionId, patchIndex.count());
            }
        } catch (RuntimeException e) { // NOSONAR - integrity pass must not break session switching
            log.error("[Integrity] Validation failed for session {}: {}", sessionId, e.getMessage(), e);
        }
        return report;
    }

    private void removeStaleTempFiles(IntegrityReport report) {
        for (String name : fileStore.listFiles()) {
            if (name.endsWith(TEMP_SUFFIX) && fileStore.delete(name)) {
                report.getRemovedTempFiles().add(name);
            }
        }
        if (!report.getRemovedTempFiles().isEmpty()) {
            log.info("[Integrity] Removed {} stale temp files: {}",
                    report.getRemovedTempFiles().size(), report.getRemovedTempFiles());
        }
    }

    private void quarantineCorruptedEntries(String sessionId, IntegrityReport report) {
        List<PatchMetadata> corrupted = new ArrayList<>();
        for (PatchMetadata patch : patchIndex.all()) {
            if (!fileStore.exists(patch.getPatchFile())) {
                corrupted.add(patch);
            }
        }
        if (corrupted.isEmpty()) {
            return;
        }

        QuarantineRecord record = QuarantineRecord.builder()
                .timestamp(clock.instant().toString())
                .sessionId(sessionId)
                .reason(QuarantineReason.MISSING_PATCH_FILE)
                .patches(corrupted)
                .build();
        String name = "patches_" + sessionId + "_" + fileTimestamp() + ".json";
        writeJson(quarantineDirectory(), name, record);

        List<Integer> numbers = corrupted.stream().map(PatchMetadata::getPatchNumber).toList();
        patchIndex.removeMany(numbers);
        patchIndex.save();
        report.getCorruptedPatches().addAll(numbers);
        log.warn("[Integrity] Quarantined {} index entries with missing patch files: {}",
                numbers.size(), numbers);
    }

    private void quarantineOrphanedFiles(String sessionId, IntegrityReport report) {
        Set<String> indexed = patchIndex.all().stream()
                .map(PatchMetadata::getPatchFile)
                .collect(Collectors.toSet());
        List<String> orphaned = fileStore.listPatchFiles().stream()
                .filter(name -> !indexed.contains(name))
                .toList();
        if (orphaned.isEmpty()) {
            return;
        }

        String targetDirectory = quarantineDirectory() + "/orphaned_" + sessionId + "_" + fileTimestamp();
        List<String> moved = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String name : orphaned) {
            try {
                storagePort.moveObject(fileStore.getDirectory(), name, targetDirectory, name).join();
                moved.add(name);
            } catch (RuntimeException e) { // NOSONAR - reported in the manifest
                log.warn("[Integrity] Failed to move orphaned file {}: {}", name, e.getMessage());
                failed.add(name);
            }
        }

        OrphanManifest manifest = OrphanManifest.builder()
                .timestamp(clock.instant().toString())
                .sessionId(sessionId)
                .reason(QuarantineReason.ORPHANED_FILES)
                .files(moved)
                .failed(failed)
                .build();
        writeJson(targetDirectory, MANIFEST_FILE, manifest);

        report.getOrphanedFiles().addAll(orphaned);
        report.getFailedMoves().addAll(failed);
        log.warn("[Integrity] Quarantined {} orphaned patch files ({} failed) into {}",
                moved.size(), failed.size(), targetDirectory);
    }

    private void writeJson(String directory, String name, Object value) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            storagePort.putTextAtomic(directory, name, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize quarantine manifest " + name, e);
        }
    }

    private String quarantineDirectory() {
        return properties.getStorage().getQuarantineDirectory();
    }

    private String fileTimestamp() {
        return clock.instant().toString().replace(':', '-').replace('.', '-');
    }
}
