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

/**
 * One {@code @@ -a,b +c,d @@} block of a unified diff.
 */
public record DiffHunk(int oldStart, int oldCount, int newStart, int newCount, List<Line> lines) {

    public static final char CONTEXT = ' ';
    public static final char REMOVED = '-';
    public static final char ADDED = '+';

    /**
     * A body line. {@code text} excludes the terminator; {@code noNewline} is
     * set when the diff marks the line with {@code \ No newline at end of file}.
     */
    public record Line(char kind, String text, boolean noNewline) {

        String value() {
            return noNewline ? text : text + "\n";
        }

        Line reversed() {
            char flipped = switch (kind) {
            case ADDED -> REMOVED;
            case REMOVED -> ADDED;
            default -> kind;
            };
            return new Line(flipped, text, noNewline);
        }
    }

    /**
     * Swap the old and new sides, turning additions into removals and back.
     */
    public DiffHunk reversed() {
        List<Line> flipped = new ArrayList<>(lines.size());
        for (Line line : lines) {
            flipped.add(line.reversed());
        }
        return new DiffHunk(newStart, newCount, oldStart, oldCount, flipped);
    }

    List<String> sourceLines() {
        List<String> source = new ArrayList<>();
        for (Line line : lines) {
            if (line.kind() != ADDED) {
                source.add(line.value());
            }
        }
        return source;
    }

    List<String> targetLines() {
        List<String> target = new ArrayList<>();
        for (Line line : lines) {
            if (line.kind() != REMOVED) {
                target.add(line.value());
            }
        }
        return target;
    }

    /**
     * Zero-based index in the old content where this hunk starts. A hunk with
     * no old lines names the line it follows.
     */
    int oldIndex() {
        return oldCount == 0 ? oldStart : oldStart - 1;
    }
}
