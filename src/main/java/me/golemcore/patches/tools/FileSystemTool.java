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
import me.golemcore.patches.domain.model.PatchOperations;
import me.golemcore.patches.domain.model.ToolDefinition;
import me.golemcore.patches.domain.model.ToolResult;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.inbound.UndoPort;
import me.golemcore.patches.port.outbound.WorkspaceFilePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for file operations within a sandboxed workspace.
 *
 * <p>
 * All paths are resolved relative to the workspace root. Files are written
 * through {@link WorkspaceFilePort}, the same atomic writer undo uses. Every
 * operation that changes a file is captured as an undo patch after the change
 * happened; a failed capture is logged and does not fail the call.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>read_file - Read text file content (max 10MB)
 * <li>write_file - Write or append text content
 * <li>edit_file - Replace exactly one occurrence of a text fragment
 * <li>delete - Delete a file
 * </ul>
 *
 * <p>
 * Configuration: {@code patches.tools.filesystem.workspace}
 *
 * @see UndoPort
 */
@Component
@Slf4j
public class FileSystemTool implements ToolComponent {

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10 MB

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_APPEND = "append";
    private static final String PARAM_OLD_TEXT = "old_text";
    private static final String PARAM_NEW_TEXT = "new_text";

    private final Path workspaceRoot;
    private final WorkspaceFilePort workspaceFiles;
    private final UndoPort undoPort;
    private final boolean enabled;

    public FileSystemTool(PatchProperties properties, WorkspaceFilePort workspaceFiles, UndoPort undoPort) {
        var config = properties.getTools().getFilesystem();
        this.enabled = config.isEnabled();
        this.workspaceRoot = Paths.get(config.getWorkspace().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.workspaceFiles = workspaceFiles;
        this.undoPort = undoPort;

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[FileSystem] Workspace: {}, enabled: {}", workspaceRoot, enabled);
        } catch (IOException e) {
            log.error("[FileSystem] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("filesystem")
                .description(
                        """
                                File operations in the workspace directory.
                                Operations: read_file, write_file, edit_file, delete.
                                Every change is recorded and can be reverted with the undo tool.
                                All paths are relative to the workspace root.
                                """)
                .inputSchema(ToolDefinition.objectSchema(properties(), List.of(PARAM_OPERATION, PARAM_PATH)))
                .build();
    }

    private static Map<String, Object> properties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_OPERATION, ToolDefinition.enumProperty(
                List.of("read_file", "write_file", "edit_file", "delete"), "Operation to perform"));
        properties.put(PARAM_PATH, ToolDefinition.property("string", "File path (relative to workspace)"));
        properties.put(PARAM_CONTENT, ToolDefinition.property("string", "Content to write (for write_file)"));
        properties.put(PARAM_APPEND, ToolDefinition.property("boolean",
                "Append to file instead of overwriting (for write_file, default: false)"));
        properties.put(PARAM_OLD_TEXT, ToolDefinition.property("string",
                "Exact text to replace, must occur once (for edit_file)"));
        properties.put(PARAM_NEW_TEXT, ToolDefinition.property("string", "Replacement text (for edit_file)"));
        return properties;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            if (!enabled) {
                log.warn("[FileSystem] Tool is DISABLED");
                return ToolResult.failure("FileSystem tool is disabled");
            }

            try {
                String operation = (String) parameters.get(PARAM_OPERATION);
                String pathStr = (String) parameters.get(PARAM_PATH);
                if (operation == null || pathStr == null) {
                    return ToolResult.failure("Missing required parameters: operation and path");
                }
                log.info("[FileSystem] Operation: {}, Path: {}", operation, pathStr);

                Optional<Path> resolved = resolveInWorkspace(pathStr);
                if (resolved.isEmpty()) {
                    log.warn("[FileSystem] Path outside workspace blocked: {}", pathStr);
                    return ToolResult.failure("Invalid path: must be within workspace");
                }
                Path path = resolved.get();

                ToolResult result = switch (operation) {
                case "read_file" -> readFile(path);
                case "write_file" -> writeFile(path, (String) parameters.get(PARAM_CONTENT),
                        Boolean.TRUE.equals(parameters.get(PARAM_APPEND)));
                case "edit_file" -> editFile(path, (String) parameters.get(PARAM_OLD_TEXT),
                        (String) parameters.get(PARAM_NEW_TEXT));
                case "delete" -> delete(path);
                default -> ToolResult.failure("Unknown operation: " + operation);
                };

                log.debug("[FileSystem] Operation '{}' result: success={}", operation, result.isSuccess());
                return result;
            } catch (ClassCastException e) {
                return ToolResult.failure("Invalid parameter type: " + e.getMessage());
            } catch (IOException e) {
                log.warn("[FileSystem] I/O failure: {}", e.getMessage());
                return ToolResult.failure("File operation failed: " + e.getMessage());
            }
        });
    }

    /**
     * Resolve against the workspace, rejecting paths that leave it either
     * lexically or through a symlink.
     */
    private Optional<Path> resolveInWorkspace(String pathStr) {
        Path resolved;
        try {
            resolved = workspaceRoot.resolve(pathStr).normalize();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (!resolved.startsWith(workspaceRoot)) {
            return Optional.empty();
        }
        if (!Files.exists(resolved)) {
            return Optional.of(resolved);
        }
        try {
            Path real = resolved.toRealPath();
            if (!real.startsWith(workspaceRoot.toRealPath())) {
                log.warn("[FileSystem] Symlink escape blocked: {} -> {}", resolved, real);
                return Optional.empty();
            }
            return Optional.of(resolved);
        } catch (IOException e) {
            log.warn("[FileSystem] Failed to resolve real path of {}: {}", pathStr, e.getMessage());
            return Optional.empty();
        }
    }

    private ToolResult readFile(Path path) throws IOException {
        if (Files.isRegularFile(path) && Files.size(path) > MAX_FILE_SIZE) {
            return ToolResult.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
        }
        Optional<String> content = workspaceFiles.readText(path);
        if (content.isEmpty()) {
            return ToolResult.failure("File not found: " + relativePath(path));
        }
        return ToolResult.success(content.get(), Map.of(
                "path", relativePath(path),
                "lines", content.get().lines().count()));
    }

    private ToolResult writeFile(Path path, String content, boolean append) throws IOException {
        if (content == null) {
            return ToolResult.failure("Missing content for write_file operation");
        }
        String original = workspaceFiles.readText(path).orElse("");
        String updated = append ? original + content : content;
        workspaceFiles.writeTextAtomic(path, updated);
        Integer patchNumber = capture(PatchOperations.WRITE, path, original, updated);

        String action = append ? "appended to" : "written to";
        return ToolResult.success("Successfully " + action + " file: " + relativePath(path), Map.of(
                "path", relativePath(path),
                "size", updated.getBytes(StandardCharsets.UTF_8).length,
                "operation", append ? "append" : "write"))
                .withPatchNumber(patchNumber);
    }

    private ToolResult editFile(Path path, String oldText, String newText) throws IOException {
        if (oldText == null || oldText.isEmpty() || newText == null) {
            return ToolResult.failure("Missing old_text or new_text for edit_file operation");
        }
        Optional<String> current = workspaceFiles.readText(path);
        if (current.isEmpty()) {
            return ToolResult.failure("File not found: " + relativePath(path));
        }
        String original = current.get();
        int first = original.indexOf(oldText);
        if (first < 0) {
            return ToolResult.failure("old_text not found in " + relativePath(path));
        }
        if (original.indexOf(oldText, first + 1) >= 0) {
            return ToolResult.failure("old_text occurs more than once in " + relativePath(path));
        }
        String updated = original.substring(0, first) + newText + original.substring(first + oldText.length());
        workspaceFiles.writeTextAtomic(path, updated);
        Integer patchNumber = capture(PatchOperations.EDIT, path, original, updated);

        return ToolResult.success("Edited file: " + relativePath(path), Map.of(
                "path", relativePath(path),
                "size", updated.getBytes(StandardCharsets.UTF_8).length))
                .withPatchNumber(patchNumber);
    }

    private ToolResult delete(Path path) throws IOException {
        if (!workspaceFiles.exists(path)) {
            return ToolResult.failure("Path not found: " + relativePath(path));
        }
        Optional<String> original = workspaceFiles.readText(path);
        if (original.isEmpty()) {
            return ToolResult.failure("Not a file: " + relativePath(path));
        }
        workspaceFiles.delete(path);
        Integer patchNumber = capture(PatchOperations.DELETE, path, original.get(), null);
        return ToolResult.success("Deleted: " + relativePath(path)).withPatchNumber(patchNumber);
    }

    private Integer capture(String operation, Path path, String original, String updated) {
        try {
            Integer patchNumber = undoPort.capture(operation, path.toString(), original, updated).join();
            if (patchNumber == null) {
                log.debug("[FileSystem] {} on {} not captured", operation, relativePath(path));
            }
            return patchNumber;
        } catch (RuntimeException e) { // NOSONAR - capture failure must not fail the file operation
            log.warn("[FileSystem] Failed to capture {} on {}: {}", operation, relativePath(path), e.getMessage());
            return null;
        }
    }

    private String relativePath(Path path) {
        return workspaceRoot.relativize(path).toString();
    }
}
