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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Caps how many patches a session keeps and how much disk they use. Oldest
 * patches go first. Count is enforced before size.
 */
@Service
@Slf4j
public class RetentionPolicy {

    private final PatchIndex patchIndex;
    private final PatchFileStore fileStore;
    private final Clock clock;

    private volatile int maxPatches;
    private volatile long maxSizeBytes;

    public RetentionPolicy(PatchIndex patchIndex, PatchFileStore fileStore, PatchProperties properties,
            Clock clock) {
        this.patchIndex = patchIndex;
        this.fileStore = fileStore;
        this.clock = clock;
        this.maxPatches = properties.getRetention().getMaxPatches();
        this.maxSizeBytes = properties.getRetention().getMaxSizeBytes();
    }

    public record Limits(int maxPatches, long maxSizeBytes) {
    }

    public Limits getLimits() {
        return new Limits(maxPatches, maxSizeBytes);
    }

    /**
     * Change limits at runtime. Null arguments keep the current value.
     */
    public void updateLimits(Integer newMaxPatches, Long newMaxSizeBytes) {
        checkLimits(newMaxPatches, newMaxSizeBytes);
        if (newMaxPatches != null) {
            this.maxPatches = newMaxPatches;
        }
        if (newMaxSizeBytes != null) {
            this.maxSizeBytes = newMaxSizeBytes;
        }
        log.info("[Retention] Limits updated: max {} patches, max {} bytes", maxPatches, maxSizeBytes);
    }

    /**
     * @throws IllegalArgumentException
     *             if a given limit is not positive
     */
    public static void checkLimits(Integer newMaxPatches, Long newMaxSizeBytes) {
        if (newMaxPatches != null && newMaxPatches <= 0) {
            throw new IllegalArgumentException("maxPatches must be positive: " + newMaxPatches);
        }
        if (newMaxSizeBytes != null && newMaxSizeBytes <= 0) {
            throw new IllegalArgumentException("maxSizeBytes must be positive: " + newMaxSizeBytes);
        }
    }

    /**
     * Evict oldest patches until both the count and the size limit hold.
     *
     * @return evicted entries, oldest first
     */
    public List<PatchMetadata> enforce() {
        List<PatchMetadata> evicted = new ArrayList<>();

        int excess = patchIndex.count() - maxPatches;
        if (excess > 0) {
            List<PatchMetadata> removed = patchIndex.removeFirst(excess);
            removed.forEach(p -> fileStore.delete(p.getPatchFile()));
            evicted.addAll(removed);
            log.info("[Retention] Evicted {} patches over the limit of {}", removed.size(), maxPatches);
        }

        long totalSize = fileStore.totalSize();
        int bySize = 0;
        while (totalSize > maxSizeBytes && patchIndex.count() > 0) {
            PatchMetadata oldest = patchIndex.removeFirst(1).get(0);
            totalSize -= fileStore.sizeOf(oldest.getPatchFile());
            fileStore.delete(oldest.getPatchFile());
            evicted.add(oldest);
            bySize++;
        }
        if (bySize > 0) {
            log.info("[Retention] Evicted {} patches to stay under {} bytes (now {} bytes)",
                    bySize, maxSizeBytes, totalSize);
        }

        if (!evicted.isEmpty()) {
            patchIndex.save();
        }
        return evicted;
    }

    /**
     * Evict patches older than {@code maxAge}. Entries whose timestamp does
     * not parse are kept.
     *
     * @return evicted entries, oldest first
     */
    public List<PatchMetadata> enforceMaxAge(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be a non-negative duration");
        }
        Instant cutoff = clock.instant().minus(maxAge);
        List<PatchMetadata> expired = new ArrayList<>();
        for (PatchMetadata patch : patchIndex.all()) {
            try {
                if (Instant.parse(patch.getTimestamp()).isBefore(cutoff)) {
                    expired.add(patch);
                }
            } catch (DateTimeParseException e) {
                log.warn("[Retention] Keeping patch {} with unparseable timestamp: {}",
                        patch.getPatchNumber(), patch.getTimestamp());
            }
        }
        if (expired.isEmpty()) {
            return expired;
        }
        patchIndex.removeMany(expired.stream().map(PatchMetadata::getPatchNumber).toList());
        expired.forEach(p -> fileStore.delete(p.getPatchFile()));
        patchIndex.save();
        log.info("[Retention] Evicted {} patches older than {}", expired.size(), maxAge);
        return expired;
    }
}
