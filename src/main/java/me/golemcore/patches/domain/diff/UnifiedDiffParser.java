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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the body of a unified diff into hunks.
 *
 * <p>
 * Accepts hunk headers with or without counts ({@code @@ -3 +3 @@} means one
 * line each). Lines outside hunks are ignored apart from noting whether file
 * headers ({@code ---}/{@code +++}) were present.
 */
public final class UnifiedDiffParser {

    private static final Pattern HUNK_HEADER = Pattern
            .compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");
    private static final String NO_NEWLINE_MARKER = "\\";

    private UnifiedDiffParser() {
    }

    /**
     * Parsed diff: its hunks, and whether any file header line was seen.
     */
    public record ParsedDiff(List<DiffHunk> hunks, boolean hasFileHeaders) {
    }

    /**
     * @throws IllegalArgumentException
     *             when a hunk body is shorter than its header promises or
     *             contains an unexpected line
     */
    public static ParsedDiff parse(String diffText) {
        List<DiffHunk> hunks = new ArrayList<>();
        boolean hasFileHeaders = false;
        if (diffText == null || diffText.isEmpty()) {
            return new ParsedDiff(hunks, false);
        }

        String[] rows = diffText.split("\n", -1);
        int i = 0;
        while (i < rows.length) {
            String row = rows[i];
            if (row.startsWith("--- ") || row.startsWith("+++ ") || row.startsWith("diff --git ")) {
                hasFileHeaders = true;
                i++;
                continue;
            }
            Matcher matcher = HUNK_HEADER.matcher(row);
            if (!matcher.matches()) {
                i++;
                continue;
            }

            int oldStart = Integer.parseInt(matcher.group(1));
            int oldCount = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 1;
            int newStart = Integer.parseInt(matcher.group(3));
            int newCount = matcher.group(4) != null ? Integer.parseInt(matcher.group(4)) : 1;
            i++;

            List<DiffHunk.Line> lines = new ArrayList<>();
            int oldSeen = 0;
            int newSeen = 0;
            while (oldSeen < oldCount || newSeen < newCount) {
                if (i >= rows.length) {
                    throw new IllegalArgumentException("Unexpected end of hunk at line " + (i + 1)
                            + ": expected " + oldCount + " old and " + newCount + " new lines");
                }
                String body = rows[i];
                if (body.startsWith(NO_NEWLINE_MARKER)) {
                    markNoNewline(lines);
                    i++;
                    continue;
                }
                char kind = body.isEmpty() ? DiffHunk.CONTEXT : body.charAt(0);
                String text = body.isEmpty() ? "" : body.substring(1);
                switch (kind) {
                case DiffHunk.CONTEXT -> {
                    oldSeen++;
                    newSeen++;
                }
                case DiffHunk.REMOVED -> oldSeen++;
                case DiffHunk.ADDED -> newSeen++;
                default -> throw new IllegalArgumentException(
                        "Unexpected line in hunk at line " + (i + 1) + ": " + body);
                }
                if (oldSeen > oldCount || newSeen > newCount) {
                    throw new IllegalArgumentException("Hunk at line " + (i + 1) + " exceeds its header counts");
                }
                lines.add(new DiffHunk.Line(kind, text, false));
                i++;
            }
            // A marker may follow the final body line.
            if (i < rows.length && rows[i].startsWith(NO_NEWLINE_MARKER)) {
                markNoNewline(lines);
                i++;
            }
            hunks.add(new DiffHunk(oldStart, oldCount, newStart, newCount, lines));
        }
        return new ParsedDiff(hunks, hasFileHeaders);
    }

    private static void markNoNewline(List<DiffHunk.Line> lines) {
        if (lines.isEmpty()) {
            return;
        }
        int last = lines.size() - 1;
        DiffHunk.Line line = lines.get(last);
        lines.set(last, new DiffHunk.Line(line.kind(), line.text(), true));
    }
}
