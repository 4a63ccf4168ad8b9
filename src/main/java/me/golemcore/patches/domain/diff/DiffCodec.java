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

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import me.golemcore.patches.domain.model.DiffStats;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds unified diffs and the patch documents that wrap them.
 *
 * <p>
 * The line diff itself comes from java-diff-utils (Myers). Formatting is done
 * here so that a last line without a trailing newline is written with the
 * standard {@code \ No newline at end of file} marker, which makes
 * reverse-applying the diff reproduce the original bytes exactly.
 *
 * <p>
 * Document layout:
 *
 * <pre>
 * # GolemCore Patch File
 * # Operation: edit
 * # File: /abs/path/App.java
 * # Timestamp: 2026-01-01T00:00:00Z
 * #
 * # To apply this patch in reverse: patch -R -p1 &lt; this_file
 * #
 * ===================================================================
 * --- a/App.java
 * +++ b/App.java
 * &#64;&#64; -1,3 +1,3 &#64;&#64;
 * ...
 * </pre>
 */
@Component
public class DiffCodec {

    public static final String DELIMITER = "===================================================================";
    private static final String NO_NEWLINE = "\\ No newline at end of file";
    private static final Pattern HUNK_COUNTS = Pattern.compile("^@@ -\\d+(?:,(\\d+))? \\+\\d+(?:,(\\d+))? @@");
    private static final List<String> DIFF_START_PREFIXES = List.of("diff --git ", "--- ", "+++ ", "@@ ");

    private final int contextLines;

    public DiffCodec(PatchProperties properties) {
        this.contextLines = Math.max(0, properties.getDiff().getContextLines());
    }

    /**
     * Build a unified diff from {@code original} to {@code updated}. Identical
     * contents give file headers with no hunks.
     */
    public String buildDiff(String original, String updated, String displayPath) {
        List<String> oldLines = TextLines.split(original);
        List<String> newLines = TextLines.split(updated);

        StringBuilder out = new StringBuilder();
        out.append("--- a/").append(displayPath).append('\n');
        out.append("+++ b/").append(displayPath).append('\n');

        List<AbstractDelta<String>> deltas = new ArrayList<>(DiffUtils.diff(oldLines, newLines).getDeltas());
        deltas.sort(Comparator.comparingInt(d -> d.getSource().getPosition()));

        int i = 0;
        while (i < deltas.size()) {
            int j = i;
            while (j + 1 < deltas.size()
                    && deltas.get(j + 1).getSource().getPosition() - sourceEnd(deltas.get(j)) <= 2 * contextLines) {
                j++;
            }
            appendHunk(out, oldLines, deltas.subList(i, j + 1));
            i = j + 1;
        }
        return out.toString();
    }

    private void appendHunk(StringBuilder out, List<String> oldLines, List<AbstractDelta<String>> group) {
        AbstractDelta<String> first = group.get(0);
        AbstractDelta<String> last = group.get(group.size() - 1);

        int oldFrom = Math.max(0, first.getSource().getPosition() - contextLines);
        int oldTo = Math.min(oldLines.size(), sourceEnd(last) + contextLines);
        int newFrom = first.getTarget().getPosition() - (first.getSource().getPosition() - oldFrom);
        int newTo = targetEnd(last) + (oldTo - sourceEnd(last));

        int oldCount = oldTo - oldFrom;
        int newCount = newTo - newFrom;
        out.append("@@ -").append(range(oldFrom, oldCount))
                .append(" +").append(range(newFrom, newCount))
                .append(" @@\n");

        int cursor = oldFrom;
        for (AbstractDelta<String> delta : group) {
            Chunk<String> source = delta.getSource();
            for (; cursor < source.getPosition(); cursor++) {
                appendLine(out, DiffHunk.CONTEXT, oldLines.get(cursor));
            }
            for (String line : source.getLines()) {
                appendLine(out, DiffHunk.REMOVED, line);
            }
            for (String line : delta.getTarget().getLines()) {
                appendLine(out, DiffHunk.ADDED, line);
            }
            cursor = sourceEnd(delta);
        }
        for (; cursor < oldTo; cursor++) {
            appendLine(out, DiffHunk.CONTEXT, oldLines.get(cursor));
        }
    }

    private static void appendLine(StringBuilder out, char prefix, String line) {
        out.append(prefix).append(TextLines.stripTerminator(line)).append('\n');
        if (!TextLines.isTerminated(line)) {
            out.append(NO_NEWLINE).append('\n');
        }
    }

    // Empty ranges name the line they follow.
    private static String range(int from, int count) {
        int start = count == 0 ? from : from + 1;
        return start + "," + count;
    }

    private static int sourceEnd(AbstractDelta<String> delta) {
        return delta.getSource().getPosition() + delta.getSource().size();
    }

    private static int targetEnd(AbstractDelta<String> delta) {
        return delta.getTarget().getPosition() + delta.getTarget().size();
    }

    /**
     * Prepend the metadata header and delimiter to a diff body.
     */
    public String wrap(String operationType, String absolutePath, String timestamp, String diffText) {
        return "# GolemCore Patch File\n"
                + "# Operation: " + operationType + "\n"
                + "# File: " + absolutePath + "\n"
                + "# Timestamp: " + timestamp + "\n"
                + "#\n"
                + "# To apply this patch in reverse: patch -R -p1 < this_file\n"
                + "#\n"
                + DELIMITER + "\n"
                + diffText;
    }

    /**
     * Recover the diff body from a stored document. Documents without the
     * delimiter are accepted when they contain a recognizable diff line.
     *
     * @return the body, or empty when the document holds no diff
     */
    public Optional<String> unwrap(String document) {
        if (document == null || document.isEmpty()) {
            return Optional.empty();
        }
        List<String> lines = TextLines.split(document);
        int offset = 0;
        for (String line : lines) {
            offset += line.length();
            if (TextLines.stripTerminator(line).equals(DELIMITER)) {
                return Optional.of(document.substring(offset));
            }
        }

        offset = 0;
        for (String line : lines) {
            for (String prefix : DIFF_START_PREFIXES) {
                if (line.startsWith(prefix)) {
                    return Optional.of(document.substring(offset));
                }
            }
            offset += line.length();
        }
        return Optional.empty();
    }

    /**
     * Count added and removed lines inside hunks. Each hunk is read for as many
     * lines as its header announces, so a removed {@code -- x} or added
     * {@code ++ x} line is counted and not mistaken for a file header. Never
     * fails: text without hunks gives zero counts.
     */
    public DiffStats stats(String diffText) {
        if (diffText == null || diffText.isEmpty()) {
            return DiffStats.EMPTY;
        }
        int additions = 0;
        int deletions = 0;
        int oldLeft = 0;
        int newLeft = 0;
        for (String line : diffText.split("\n")) {
            if (oldLeft > 0 || newLeft > 0) {
                char marker = line.isEmpty() ? DiffHunk.CONTEXT : line.charAt(0);
                if (marker == DiffHunk.ADDED) {
                    additions++;
                    newLeft--;
                } else if (marker == DiffHunk.REMOVED) {
                    deletions++;
                    oldLeft--;
                } else if (marker != '\\') {
                    oldLeft--;
                    newLeft--;
                }
                continue;
            }
            Matcher header = HUNK_COUNTS.matcher(line);
            if (header.find()) {
                oldLeft = header.group(1) != null ? Integer.parseInt(header.group(1)) : 1;
                newLeft = header.group(2) != null ? Integer.parseInt(header.group(2)) : 1;
            }
        }
        return DiffStats.of(additions, deletions);
    }
}
