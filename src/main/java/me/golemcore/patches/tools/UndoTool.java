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

package me.golemcore.patches.tools;

import me.golemcore.patches.domain.component.ToolComponent;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.domain.model.PatchStats;
import me.golemcore.patches.domain.model.ToolDefinition;
import me.golemcore.patches.domain.model.ToolResult;
import me.golemcore.patches.domain.model.UndoFileEntry;
import me.golemcore.patches.domain.model.UndoPreview;
import me.golemcore.patches.domain.model.UndoResult;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.inbound.UndoPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Agent-facing access to the undo history of the current session.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>list - Recent changes with added/removed line counts
 * <li>preview - Show what undoing would produce, without changing anything
 * <li>preview_since - Preview undoing every change at or after a timestamp
 * <li>undo - Revert the last {@code count} changes, or one {@code patch_number}
 * <li>undo_since - Revert every change at or after a timestamp
 * <li>history - Raw patch metadata, newest first
 * <li>stats - Patch count, size and counts per operation
 * </ul>
 */
@Component
@Slf4j
public class UndoTool implements ToolComponent {

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_COUNT = "count";
    private static final String PARAM_PATCH_NUMBER = "patch_number";
    private static final String PARAM_SINCE = "since";
    private static final String PARAM_LIMIT = "limit";

    private final UndoPort undoPort;
    private final boolean enabled;
    private final int defaultListLimit;

    public UndoTool(PatchProperties properties, UndoPort undoPort) {
        var config = properties.getTools().getUndo();
        this.enabled = config.isEnabled();
        this.defaultListLimit = config.getDefaultListLimit();
        this.undoPort = undoPort;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("undo")
                .description("""
                        Undo file changes made in this session.
                        Operations: list, preview, preview_since, undo, undo_since, history, stats.
                        Use preview before undo when unsure what will change.
                        """)
                .inputSchema(ToolDefinition.objectSchema(properties(), List.of(PARAM_OPERATION)))
                .build();
    }

    private static Map<String, Object> properties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_OPERATION, ToolDefinition.enumProperty(
                List.of("list", "preview", "preview_since", "undo", "undo_since", "history", "stats"),
                "Operation to perform"));
        properties.put(PARAM_COUNT, ToolDefinition.property("integer",
                "Number of most recent changes (preview, undo; default 1)"));
        properties.put(PARAM_PATCH_NUMBER, ToolDefinition.property("integer", "Specific patch to preview or undo"));
        properties.put(PARAM_SINCE, ToolDefinition.property("string", "ISO-8601 timestamp (preview_since, undo_since)"));
        properties.put(PARAM_LIMIT, ToolDefinition.property("integer", "Maximum entries (list, history)"));
        return properties;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            if (!enabled) {
                return ToolResult.failure("Undo tool is disabled");
            }
            String operation = parameters.get(PARAM_OPERATION) instanceof String s ? s : null;
            if (operation == null) {
                return ToolResult.failure("Missing required parameter: operation");
            }
            log.info("[Undo] Tool operation: {}", operation);

            try {
                return switch (operation) {
                case "list" -> list(intParam(parameters, PARAM_LIMIT, defaultListLimit));
                case "preview" -> preview(parameters);
                case "preview_since" -> previewSince(parameters);
                case "undo" -> undo(parameters);
                case "undo_since" -> undoSince(parameters);
                case "history" -> history(intParam(parameters, PARAM_LIMIT, defaultListLimit));
                case "stats" -> stats();
                default -> ToolResult.failure("Unknown operation: " + operation);
                };
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(e.getMessage());
            } catch (CompletionException e) {
                log.error("[Undo] Operation {} failed: {}", operation, e.getMessage(), e);
                return ToolResult.failure("Undo operation failed: " + e.getCause().getMessage());
            }
        });
    }

    private ToolResult list(int limit) {
        List<UndoFileEntry> entries = undoPort.recentFileList(limit).join();
        if (entries.isEmpty()) {
            return ToolResult.success("No changes recorded in this session", entries);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Recent changes (newest first):\n");
        for (UndoFileEntry entry : entries) {
            sb.append(String.format("#%d %s %s (+%d -%d) at %s%n",
                    entry.getPatchNumber(), entry.getOperationType(), entry.getFilePath(),
                    entry.getStats().additions(), entry.getStats().deletions(), entry.getTimestamp()));
        }
        return ToolResult.success(sb.toString(), entries);
    }

    private ToolResult preview(Map<String, Object> parameters) {
        Integer patchNumber = optionalInt(parameters, PARAM_PATCH_NUMBER);
        if (patchNumber != null) {
            UndoPreview single = undoPort.previewSingle(patchNumber).join();
            return formatPreviews(single != null ? List.of(single) : null);
        }
        return formatPreviews(undoPort.previewLast(intParam(parameters, PARAM_COUNT, 1)).join());
    }

    private ToolResult previewSince(Map<String, Object> parameters) {
        return formatPreviews(undoPort.previewSince(requiredSince(parameters)).join());
    }

    private static ToolResult formatPreviews(List<UndoPreview> previews) {
        if (previews == null || previews.isEmpty()) {
            return ToolResult.success("Nothing to preview");
        }
        StringBuilder sb = new StringBuilder();
        for (UndoPreview preview : previews) {
            sb.append("Patch #").append(preview.getPatchNumber()).append(' ')
                    .append(preview.getOperationType()).append(' ').append(preview.getFilePath()).append('\n');
            sb.append(preview.getPredictedContent().isEmpty()
                    ? "  file would be removed\n"
                    : "  file would have " + preview.getPredictedContent().length() + " characters\n");
        }
        return ToolResult.success(sb.toString(), previews);
    }

    private ToolResult undo(Map<String, Object> parameters) {
        Integer patchNumber = optionalInt(parameters, PARAM_PATCH_NUMBER);
        UndoResult result = patchNumber != null
                ? undoPort.undoSingle(patchNumber).join()
                : undoPort.undoLast(intParam(parameters, PARAM_COUNT, 1)).join();
        return toToolResult(result);
    }

    private ToolResult undoSince(Map<String, Object> parameters) {
        return toToolResult(undoPort.undoSince(requiredSince(parameters)).join());
    }

    private static String requiredSince(Map<String, Object> parameters) {
        Object since = parameters.get(PARAM_SINCE);
        if (!(since instanceof String text)) {
            throw new IllegalArgumentException("Missing required parameter: since");
        }
        return text;
    }

    private ToolResult history(int limit) {
        List<PatchMetadata> patches = undoPort.history(limit).join();
        StringBuilder sb = new StringBuilder();
        sb.append("Patch history (").append(patches.size()).append(" entries):\n");
        for (PatchMetadata patch : patches) {
            sb.append(String.format("#%d %s %s at %s%n",
                    patch.getPatchNumber(), patch.getOperationType(), patch.getFilePath(), patch.getTimestamp()));
        }
        return ToolResult.success(sb.toString(), patches);
    }

    private ToolResult stats() {
        PatchStats stats = undoPort.stats().join();
        String output = String.format("Patches: %d, size: %d bytes, next: #%d, by operation: %s",
                stats.getTotalPatches(), stats.getTotalSizeBytes(), stats.getNextPatchNumber(),
                stats.getOperationCounts());
        return ToolResult.success(output, stats);
    }

    private static ToolResult toToolResult(UndoResult result) {
        if (result.isSuccess()) {
            return ToolResult.success("Reverted " + result.getRevertedFiles().size() + " change(s): "
                    + String.join(", ", result.getRevertedFiles()), result);
        }
        return ToolResult.builder()
                .success(false)
                .error(String.join("; ", result.getFailedOperations()))
                .data(result)
                .build();
    }

    private static Integer optionalInt(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer: " + value, e);
        }
    }

    private static int intParam(Map<String, Object> parameters, String name, int defaultValue) {
        Integer value = optionalInt(parameters, name);
        return value != null ? value : defaultValue;
    }
}
