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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.domain.model.PatchIndexDocument;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered catalog of the active session's patches, persisted as
 * {@code <session>/patches/patch_index.json}.
 *
 * <p>
 * Mutating methods change the in-memory catalog only; callers persist with
 * {@link #save()} once their whole change is done. {@code next_patch_number}
 * never decreases while the index lives, so numbers are not reused after
 * removals. Only {@link #clear()} resets it.
 *
 * <p>
 * Not thread-safe. All access goes through the session write queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatchIndex {

    private final StoragePort storagePort;
    private final PatchIndexValidator validator;
    private final ObjectMapper objectMapper;
    private final PatchProperties properties;

    private String directory;
    private PatchIndexDocument document = PatchIndexDocument.empty();

    /**
     * Point the index at a session, or detach it with {@code null}. The
     * in-memory catalog is reset; call {@link #load()} to read it.
     */
    public void bindSession(String sessionId) {
        this.directory = sessionId == null
                ? null
                : sessionId + "/" + properties.getStorage().getPatchesDirectory();
        this.document = PatchIndexDocument.empty();
    }

    /**
     * Read the index from disk. A missing file gives a fresh index; an
     * unreadable or structurally invalid one is logged and replaced by a fresh
     * index rather than failing. A {@code next_patch_number} that does not
     * exceed every stored patch number is raised past the highest one.
     */
    public PatchIndexDocument load() {
        document = PatchIndexDocument.empty();
        if (directory == null) {
            return document;
        }
        String indexFile = properties.getStorage().getIndexFile();
        try {
            String json = storagePort.getText(directory, indexFile).join();
            if (json == null || json.isBlank()) {
                log.debug("[Patches] No index at {}/{}, starting fresh", directory, indexFile);
                return document;
            }
            JsonNode tree = objectMapper.readTree(json);
            List<String> errors = validator.validateStructure(tree);
            if (!errors.isEmpty()) {
                log.warn("[Patches] Invalid patch index at {}, resetting: {}", directory, errors);
                return document;
            }
            document = objectMapper.treeToValue(tree, PatchIndexDocument.class);
            if (document.getPatches() == null) {
                document.setPatches(new ArrayList<>());
            }
            int highest = validator.maxPatchNumber(tree);
            if (document.getNextPatchNumber() <= highest) {
                log.warn("[Patches] next_patch_number {} at {} is not above patch #{}, raising it to {}",
                        document.getNextPatchNumber(), directory, highest, highest + 1);
                document.setNextPatchNumber(highest + 1);
            }
            log.debug("[Patches] Loaded index with {} patches (next: {})",
                    document.getPatches().size(), document.getNextPatchNumber());
        } catch (JsonProcessingException e) {
            log.warn("[Patches] Corrupt patch index at {}, resetting: {}", directory, e.getOriginalMessage());
            document = PatchIndexDocument.empty();
        } catch (RuntimeException e) { // NOSONAR - unreadable index falls back to a fresh one
            log.warn("[Patches] Failed to read patch index at {}, resetting: {}", directory, e.getMessage());
            document = PatchIndexDocument.empty();
        }
        return document;
    }

    /**
     * Persist the index atomically. No-op without a session.
     *
     * @throws IllegalStateException
     *             if the in-memory index is structurally invalid
     */
    public void save() {
        if (directory == null) {
            return;
        }
        List<String> errors = validator.validate(document);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Refusing to save invalid patch index: " + errors);
        }
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
            storagePort.putTextAtomic(directory, properties.getStorage().getIndexFile(), json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize patch index", e);
        }
    }

    public void add(PatchMetadata metadata) {
        if (!validator.isValid(metadata)) {
            throw new IllegalArgumentException("Invalid patch metadata: " + metadata);
        }
        if (get(metadata.getPatchNumber()).isPresent()) {
            throw new IllegalArgumentException("Patch " + metadata.getPatchNumber() + " already indexed");
        }
        document.getPatches().add(metadata);
    }

    public boolean remove(int patchNumber) {
        return document.getPatches().removeIf(p -> p.getPatchNumber() == patchNumber);
    }

    public int removeMany(Collection<Integer> patchNumbers) {
        Set<Integer> numbers = Set.copyOf(patchNumbers);
        int before = document.getPatches().size();
        document.getPatches().removeIf(p -> numbers.contains(p.getPatchNumber()));
        return before - document.getPatches().size();
    }

    /**
     * Remove the {@code n} newest entries.
     *
     * @return removed entries, oldest first
     */
    public List<PatchMetadata> removeLast(int n) {
        List<PatchMetadata> patches = document.getPatches();
        int from = Math.max(0, patches.size() - Math.max(0, n));
        List<PatchMetadata> tail = patches.subList(from, patches.size());
        List<PatchMetadata> removed = new ArrayList<>(tail);
        tail.clear();
        return removed;
    }

    /**
     * Remove the {@code n} oldest entries.
     *
     * @return removed entries, oldest first
     */
    public List<PatchMetadata> removeFirst(int n) {
        List<PatchMetadata> patches = document.getPatches();
        int to = Math.min(patches.size(), Math.max(0, n));
        List<PatchMetadata> head = patches.subList(0, to);
        List<PatchMetadata> removed = new ArrayList<>(head);
        head.clear();
        return removed;
    }

    public Optional<PatchMetadata> get(int patchNumber) {
        return document.getPatches().stream()
                .filter(p -> p.getPatchNumber() == patchNumber)
                .findFirst();
    }

    /**
     * The {@code n} newest entries in chronological order.
     */
    public List<PatchMetadata> last(int n) {
        List<PatchMetadata> patches = document.getPatches();
        int from = Math.max(0, patches.size() - Math.max(0, n));
        return new ArrayList<>(patches.subList(from, patches.size()));
    }

    /**
     * Entries with a timestamp at or after {@code since}, chronological.
     * Entries whose timestamp does not parse are skipped.
     */
    public List<PatchMetadata> since(Instant since) {
        List<PatchMetadata> matching = new ArrayList<>();
        for (PatchMetadata patch : document.getPatches()) {
            try {
                if (patch.getTimestamp() != null && !Instant.parse(patch.getTimestamp()).isBefore(since)) {
                    matching.add(patch);
                }
            } catch (DateTimeParseException e) {
                log.warn("[Patches] Skipping patch {} with invalid timestamp: {}",
                        patch.getPatchNumber(), patch.getTimestamp());
            }
        }
        return matching;
    }

    public int nextNumber() {
        return document.getNextPatchNumber();
    }

    public int incrementNumber() {
        document.setNextPatchNumber(document.getNextPatchNumber() + 1);
        return document.getNextPatchNumber();
    }

    public int count() {
        return document.getPatches().size();
    }

    public Map<String, Integer> operationCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PatchMetadata patch : document.getPatches()) {
            counts.merge(patch.getOperationType(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Entries newest first, at most {@code limit} of them when a limit is
     * given.
     */
    public List<PatchMetadata> history(Integer limit) {
        List<PatchMetadata> reversed = new ArrayList<>(document.getPatches());
        Collections.reverse(reversed);
        if (limit != null && limit >= 0 && limit < reversed.size()) {
            return new ArrayList<>(reversed.subList(0, limit));
        }
        return reversed;
    }

    /**
     * Replace operation type, file path or timestamp of an entry. Null fields
     * of {@code changes} are left alone; number and file name never change.
     *
     * @return false when the entry does not exist or the result would be
     *         invalid
     */
    public boolean update(int patchNumber, PatchMetadata changes) {
        Iterator<PatchMetadata> it = document.getPatches().iterator();
        int position = 0;
        while (it.hasNext()) {
            PatchMetadata current = it.next();
            if (current.getPatchNumber() == patchNumber) {
                PatchMetadata updated = current.toBuilder()
                        .operationType(changes.getOperationType() != null
                                ? changes.getOperationType()
                                : current.getOperationType())
                        .filePath(changes.getFilePath() != null ? changes.getFilePath() : current.getFilePath())
                        .timestamp(changes.getTimestamp() != null ? changes.getTimestamp() : current.getTimestamp())
                        .build();
                if (!validator.isValid(updated)) {
                    return false;
                }
                document.getPatches().set(position, updated);
                return true;
            }
            position++;
        }
        return false;
    }

    public List<PatchMetadata> all() {
        return new ArrayList<>(document.getPatches());
    }

    /**
     * Drop every entry and restart numbering at 1.
     */
    public void clear() {
        document = PatchIndexDocument.empty();
    }

    public String getDirectory() {
        return directory;
    }
}
