package me.golemcore.patches.tools;

import me.golemcore.patches.domain.model.DiffStats;
import me.golemcore.patches.domain.model.PatchStats;
import me.golemcore.patches.domain.model.ToolResult;
import me.golemcore.patches.domain.model.UndoFileEntry;
import me.golemcore.patches.domain.model.UndoPreview;
import me.golemcore.patches.domain.model.UndoResult;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.inbound.UndoPort;
import me.golemcore.patches.testsupport.PatchTestStack;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UndoToolTest {

    private static final String OPERATION = "operation";

    @TempDir
    Path tempDir;

    private UndoPort undoPort;
    private UndoTool tool;

    @BeforeEach
    void setUp() {
        undoPort = mock(UndoPort.class);
        tool = new UndoTool(new PatchProperties(), undoPort);
    }

    // ==================== UNDO ====================

    @Test
    void undoDefaultsToLastChange() throws Exception {
        when(undoPort.undoLast(1)).thenReturn(CompletableFuture.completedFuture(
                UndoResult.of(List.of("/w/a.txt"), List.of())));

        ToolResult result = tool.execute(Map.of(OPERATION, "undo")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("/w/a.txt"));
        verify(undoPort).undoLast(1);
    }

    @Test
    void undoWithPatchNumberUndoesSinglePatch() throws Exception {
        when(undoPort.undoSingle(4)).thenReturn(CompletableFuture.completedFuture(
                UndoResult.failure("Patch 4 not found")));

        ToolResult result = tool.execute(Map.of(OPERATION, "undo", "patch_number", "4")).get();

        assertFalse(result.isSuccess());
        assertEquals("Patch 4 not found", result.getError());
        verify(undoPort, never()).undoLast(1);
    }

    @Test
    void argumentErrorsBecomeFailures() throws Exception {
        when(undoPort.undoLast(0)).thenThrow(new IllegalArgumentException("count must be positive: 0"));

        ToolResult zero = tool.execute(Map.of(OPERATION, "undo", "count", 0)).get();
        ToolResult notNumber = tool.execute(Map.of(OPERATION, "undo", "count", "many")).get();
        ToolResult noSince = tool.execute(Map.of(OPERATION, "undo_since")).get();

        assertEquals("count must be positive: 0", zero.getError());
        assertTrue(notNumber.getError().contains("must be an integer"));
        assertEquals("Missing required parameter: since", noSince.getError());
    }

    @Test
    void undoSincePassesTimestamp() throws Exception {
        when(undoPort.undoSince("2026-01-15T10:00:00Z")).thenReturn(CompletableFuture.completedFuture(
                UndoResult.of(List.of("/w/a.txt", "/w/b.txt"), List.of())));

        ToolResult result = tool.execute(Map.of(OPERATION, "undo_since", "since", "2026-01-15T10:00:00Z")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Reverted 2 change(s)"));
    }

    // ==================== REPORTING ====================

    @Test
    void listFormatsEntries() throws Exception {
        UndoFileEntry entry = UndoFileEntry.builder()
                .patchNumber(3)
                .filePath("/w/a.txt")
                .operationType("edit")
                .timestamp("2026-01-15T10:00:00Z")
                .stats(DiffStats.of(2, 1))
                .build();
        when(undoPort.recentFileList(10)).thenReturn(CompletableFuture.completedFuture(List.of(entry)));

        ToolResult result = tool.execute(Map.of(OPERATION, "list")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("#3 edit /w/a.txt (+2 -1)"));
    }

    @Test
    void previewWithNothingToPreview() throws Exception {
        when(undoPort.previewLast(1)).thenReturn(CompletableFuture.completedFuture(null));

        ToolResult result = tool.execute(Map.of(OPERATION, "preview")).get();

        assertTrue(result.isSuccess());
        assertEquals("Nothing to preview", result.getOutput());
    }

    @Test
    void previewDescribesRemovedFile() throws Exception {
        UndoPreview preview = UndoPreview.builder()
                .patchNumber(1)
                .operationType("write")
                .filePath("/w/new.txt")
                .currentContent("new\n")
                .predictedContent("")
                .build();
        when(undoPort.previewSingle(1)).thenReturn(CompletableFuture.completedFuture(preview));

        ToolResult result = tool.execute(Map.of(OPERATION, "preview", "patch_number", 1)).get();

        assertTrue(result.getOutput().contains("file would be removed"));
    }

    @Test
    void previewSincePassesTimestamp() throws Exception {
        UndoPreview preview = UndoPreview.builder()
                .patchNumber(2)
                .operationType("edit")
                .filePath("/w/a.txt")
                .currentContent("two\n")
                .predictedContent("one\n")
                .build();
        when(undoPort.previewSince("2026-01-15T10:00:00Z"))
                .thenReturn(CompletableFuture.completedFuture(List.of(preview)));

        ToolResult result = tool.execute(Map.of(OPERATION, "preview_since", "since", "2026-01-15T10:00:00Z")).get();
        ToolResult missing = tool.execute(Map.of(OPERATION, "preview_since")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().contains("Patch #2 edit /w/a.txt"));
        assertTrue(result.getOutput().contains("file would have 4 characters"));
        assertEquals("Missing required parameter: since", missing.getError());
    }

    @Test
    void statsReportsCounts() throws Exception {
        PatchStats stats = PatchStats.builder()
                .patchesDirectory("s1/patches")
                .totalPatches(2)
                .operationCounts(Map.of("write", 2))
                .totalSizeBytes(512)
                .nextPatchNumber(3)
                .build();
        when(undoPort.stats()).thenReturn(CompletableFuture.completedFuture(stats));

        ToolResult result = tool.execute(Map.of(OPERATION, "stats")).get();

        assertTrue(result.getOutput().startsWith("Patches: 2, size: 512 bytes, next: #3"));
        assertSame(stats, result.getData());
    }

    @Test
    void failedFutureBecomesFailure() throws Exception {
        when(undoPort.history(10)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broken")));

        ToolResult result = tool.execute(Map.of(OPERATION, "history")).get();

        assertFalse(result.isSuccess());
        assertEquals("Undo operation failed: broken", result.getError());
    }

    @Test
    void unknownOrMissingOperation() throws Exception {
        assertEquals("Unknown operation: redo", tool.execute(Map.of(OPERATION, "redo")).get().getError());
        assertEquals("Missing required parameter: operation", tool.execute(Map.of()).get().getError());
    }

    // ==================== END TO END ====================

    @Test
    void writeThenUndoThroughTools() throws Exception {
        PatchTestStack stack = PatchTestStack.create(tempDir);
        try {
            stack.activate("s1");
            FileSystemTool files = new FileSystemTool(stack.properties, stack.workspaceFiles, stack.manager);
            UndoTool undo = new UndoTool(stack.properties, stack.manager);

            files.execute(Map.of(OPERATION, "write_file", "path", "notes.md", "content", "one\n")).get();
            ToolResult edit = files.execute(Map.of(OPERATION, "edit_file", "path", "notes.md",
                    "old_text", "one", "new_text", "two")).get();
            assertEquals(2, edit.getPatchNumber());

            ToolResult result = undo.execute(Map.of(OPERATION, "undo")).get();

            assertTrue(result.isSuccess());
            UndoResult undoResult = (UndoResult) result.getData();
            assertEquals(List.of(stack.workspaceFile("notes.md").toAbsolutePath().normalize().toString()),
                    undoResult.getRevertedFiles());
            assertEquals("one\n", Files.readString(stack.workspaceFile("notes.md")));
        } finally {
            stack.close();
        }
    }
}
