package me.golemcore.patches.domain.diff;

import me.golemcore.patches.domain.model.DiffStats;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DiffCodecTest {

    private static final String FILE_NAME = "f.txt";
    private static final String TIMESTAMP = "2026-01-15T10:00:00Z";

    private DiffCodec codec;

    @BeforeEach
    void setUp() {
        codec = new DiffCodec(new PatchProperties());
    }

    // ==================== buildDiff ====================

    @Test
    void buildDiffProducesUnifiedHunkWithContext() {
        String diff = codec.buildDiff("a\nb\nc\n", "a\nB\nc\n", FILE_NAME);

        assertEquals("""
                --- a/f.txt
                +++ b/f.txt
                @@ -1,3 +1,3 @@
                 a
                -b
                +B
                 c
                """, diff);
    }

    @Test
    void buildDiffForNewFileMarksMissingTrailingNewline() {
        String diff = codec.buildDiff("", "x\ny", "n.txt");

        assertEquals("--- a/n.txt\n+++ b/n.txt\n@@ -0,0 +1,2 @@\n+x\n+y\n\\ No newline at end of file\n", diff);
    }

    @Test
    void buildDiffForDeletionRemovesAllLines() {
        String diff = codec.buildDiff("one\ntwo\n", "", FILE_NAME);

        assertTrue(diff.contains("@@ -1,2 +0,0 @@\n-one\n-two\n"));
    }

    @Test
    void buildDiffOfIdenticalContentHasNoHunks() {
        String diff = codec.buildDiff("same\n", "same\n", FILE_NAME);

        assertEquals("--- a/f.txt\n+++ b/f.txt\n", diff);
    }

    @Test
    void buildDiffSplitsDistantChangesIntoSeparateHunks() {
        String original = numberedLines(20);
        String updated = original.replace("line2\n", "changed2\n").replace("line18\n", "changed18\n");

        String diff = codec.buildDiff(original, updated, FILE_NAME);

        assertEquals(2, diff.lines().filter(l -> l.startsWith("@@ ")).count());
    }

    @Test
    void buildDiffMergesNearbyChangesIntoOneHunk() {
        String original = numberedLines(20);
        String updated = original.replace("line2\n", "changed2\n").replace("line6\n", "changed6\n");

        String diff = codec.buildDiff(original, updated, FILE_NAME);

        assertEquals(1, diff.lines().filter(l -> l.startsWith("@@ ")).count());
    }

    @Test
    void buildDiffHonorsConfiguredContext() {
        PatchProperties properties = new PatchProperties();
        properties.getDiff().setContextLines(0);
        DiffCodec noContext = new DiffCodec(properties);

        String diff = noContext.buildDiff("a\nb\nc\n", "a\nB\nc\n", FILE_NAME);

        assertTrue(diff.contains("@@ -2,1 +2,1 @@\n-b\n+B\n"));
        assertFalse(diff.contains(" a\n"));
    }

    // ==================== wrap / unwrap ====================

    @Test
    void wrapAddsHeaderAndDelimiter() {
        String document = codec.wrap("edit", "/work/f.txt", TIMESTAMP, "--- a/f.txt\n+++ b/f.txt\n");

        assertTrue(document.startsWith("# GolemCore Patch File\n# Operation: edit\n# File: /work/f.txt\n"));
        assertTrue(document.contains("# Timestamp: " + TIMESTAMP + "\n"));
        assertTrue(document.contains(DiffCodec.DELIMITER + "\n--- a/f.txt\n"));
    }

    @Test
    void unwrapReturnsExactlyTheEmbeddedDiff() {
        String diff = codec.buildDiff("a\n", "b\n", FILE_NAME);
        String document = codec.wrap("write", "/work/f.txt", TIMESTAMP, diff);

        assertEquals(Optional.of(diff), codec.unwrap(document));
    }

    @Test
    void unwrapAcceptsBareDiffWithoutHeader() {
        String diff = "--- a/f.txt\n+++ b/f.txt\n@@ -1,1 +1,1 @@\n-a\n+b\n";

        assertEquals(Optional.of(diff), codec.unwrap(diff));
    }

    @Test
    void unwrapSkipsUnknownHeaderWithoutDelimiter() {
        String document = "# some older header\n# more\n@@ -1,1 +1,1 @@\n-a\n+b\n";

        assertEquals(Optional.of("@@ -1,1 +1,1 @@\n-a\n+b\n"), codec.unwrap(document));
    }

    @Test
    void unwrapReturnsEmptyForTextWithoutDiff() {
        assertTrue(codec.unwrap("just some notes\nnothing else\n").isEmpty());
        assertTrue(codec.unwrap("").isEmpty());
        assertTrue(codec.unwrap(null).isEmpty());
    }

    // ==================== stats ====================

    @Test
    void statsCountsAdditionsAndDeletionsExcludingFileHeaders() {
        String diff = "--- a/f.txt\n+++ b/f.txt\n@@ -1,2 +1,3 @@\n keep\n-old\n+new\n+more\n";

        assertEquals(new DiffStats(2, 1, 3), codec.stats(diff));
    }

    @Test
    void statsCountsHunkLinesThatLookLikeFileHeaders() {
        String diff = "--- a/f.sql\n+++ b/f.sql\n@@ -1,2 +1,2 @@\n--- old comment\n+++ new counter\n keep\n";

        assertEquals(new DiffStats(1, 1, 2), codec.stats(diff));
    }

    @Test
    void statsOfBuiltDiffWithDashedLines() {
        String diff = codec.buildDiff("-- a\nkeep\n", "++ b\nkeep\n", "f.sql");

        assertEquals(DiffStats.of(1, 1), codec.stats(diff));
    }

    @Test
    void statsOfMalformedInputIsZero() {
        assertEquals(DiffStats.EMPTY, codec.stats("not a diff at all"));
        assertEquals(DiffStats.EMPTY, codec.stats(null));
    }

    private static String numberedLines(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            sb.append("line").append(i).append('\n');
        }
        return sb.toString();
    }
}
