package me.golemcore.patches.domain.diff;

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
import me.golemcore.patches.domain.model.PatchApplyResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies unified diffs to in-memory content, forward or in reverse.
 *
 * <p>
 * Each hunk is first tried at the position its header names (shifted by what
 * earlier hunks added or removed). When the context does not match there, the
 * nearest matching position is searched for in both directions, never before
 * the end of the previous hunk. A hunk that matches nowhere fails the whole
 * application; nothing partial is returned.
 */
@Component
@Slf4j
public class PatchApplier {

    public PatchApplyResult apply(String diffText, String content, boolean reverse) {
        UnifiedDiffParser.ParsedDiff parsed;
        try {
            parsed = UnifiedDiffParser.parse(diffText);
        } catch (IllegalArgumentException e) {
            return PatchApplyResult.failure("Malformed diff: " + e.getMessage());
        }

        if (parsed.hunks().isEmpty()) {
            if (parsed.hasFileHeaders()) {
                return PatchApplyResult.success(content == null ? "" : content);
            }
            return PatchApplyResult.failure("No hunks found in patch");
        }

        List<String> result = new ArrayList<>(TextLines.split(content));
        int shift = 0;
        int floor = 0;
        int hunkNumber = 0;
        for (DiffHunk original : parsed.hunks()) {
            hunkNumber++;
            DiffHunk hunk = reverse ? original.reversed() : original;
            List<String> source = hunk.sourceLines();
            List<String> target = hunk.targetLines();

            int expected = Math.max(floor, hunk.oldIndex() + shift);
            int position = locate(result, source, expected, floor);
            if (position < 0) {
                return PatchApplyResult.failure("Hunk " + hunkNumber + " does not match content at line "
                        + (hunk.oldIndex() + 1) + " (stale patch?)");
            }
            if (position != expected) {
                log.debug("[Patches] Hunk {} applied with offset {}", hunkNumber, position - expected);
            }

            result.subList(position, position + source.size()).clear();
            result.addAll(position, target);

            shift = position - hunk.oldIndex() + target.size() - source.size();
            floor = position + target.size();
        }
        return PatchApplyResult.success(TextLines.join(result));
    }

    /**
     * Same as {@link #apply} but reports failure as an empty result instead of
     * an error. Never touches storage.
     */
    public Optional<String> simulate(String diffText, String content, boolean reverse) {
        PatchApplyResult result = apply(diffText, content, reverse);
        return result.isSuccess() ? Optional.of(result.getContent()) : Optional.empty();
    }

    private static int locate(List<String> lines, List<String> source, int expected, int floor) {
        int maxStart = lines.size() - source.size();
        if (maxStart < floor) {
            return -1;
        }
        if (source.isEmpty()) {
            return Math.min(expected, lines.size());
        }
        int span = Math.max(expected - floor, maxStart - expected);
        for (int delta = 0; delta <= span; delta++) {
            int below = expected - delta;
            if (below >= floor && below <= maxStart && matchesAt(lines, source, below)) {
                return below;
            }
            int above = expected + delta;
            if (delta > 0 && above >= floor && above <= maxStart && matchesAt(lines, source, above)) {
                return above;
            }
        }
        return -1;
    }

    private static boolean matchesAt(List<String> lines, List<String> source, int position) {
        for (int k = 0; k < source.size(); k++) {
            if (!lines.get(position + k).equals(source.get(k))) {
                return false;
            }
        }
        return true;
    }
}
