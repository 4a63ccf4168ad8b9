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

package me.golemcore.patches.adapter.outbound.storage;

import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Layout under the sessions root:
 * <ul>
 * <li>&lt;session&gt;/patches/ - patch documents and the patch index
 * <li>.quarantine/ - quarantined index entries and orphaned documents
 * </ul>
 *
 * <p>
 * Root configured via {@code patches.storage.sessions-path}, defaults to
 * {@code ${user.home}/.golemcore/sessions}.
 *
 * @see me.golemcore.patches.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";

    private final PatchProperties properties;

    private Path sessionsRoot;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getSessionsPath();
        this.sessionsRoot = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(sessionsRoot);
            log.info("[Storage] Sessions root: {}", sessionsRoot);
        } catch (IOException e) {
            log.error("[Storage] Failed to create sessions root {}", sessionsRoot, e);
        }
    }

    public Path getSessionsRoot() {
        return sessionsRoot;
    }

    /**
     * Temp sibling, synced to disk and size-checked, then renamed over the
     * target. The temp file is removed when any step fails.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            try {
                createParent(target);
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                replace(temp, target);
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                discardTemp(temp);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.isRegularFile(resolvePath(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> deleteObject(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = resolveDirectory(directory);
            if (!Files.isDirectory(dir)) {
                return Collections.emptyList();
            }
            try (Stream<Path> entries = Files.list(dir)) {
                return entries
                        .filter(Files::isRegularFile)
                        .map(p -> p.getFileName().toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Long> sizeOf(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            try {
                return Files.isRegularFile(file) ? Files.size(file) : 0L;
            } catch (IOException e) {
                log.debug("[Storage] Failed to stat {}: {}", file, e.getMessage());
                return 0L;
            }
        });
    }

    @Override
    public CompletableFuture<Void> moveObject(String directory, String path, String targetDirectory,
            String targetPath) {
        return CompletableFuture.runAsync(() -> {
            Path source = resolvePath(directory, path);
            Path target = resolvePath(targetDirectory, targetPath);
            try {
                createParent(target);
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
                log.debug("[Storage] Moved {} -> {}", source, target);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to move file: " + directory + "/" + path
                        + " -> " + targetDirectory + "/" + targetPath, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            Path dir = resolveDirectory(directory);
            if (dir.equals(sessionsRoot)) {
                throw new IllegalArgumentException("Refusing to delete the sessions root");
            }
            if (!Files.exists(dir)) {
                return;
            }
            try (Stream<Path> tree = Files.walk(dir)) {
                for (Path p : tree.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(p);
                }
                log.debug("[Storage] Deleted directory {}", dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(resolveDirectory(directory));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + directory, e);
            }
        });
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void writeSynced(Path temp, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(temp) != bytes.length) {
            throw new IOException("Verification failed: size mismatch for " + temp.getFileName());
        }
    }

    private static void replace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported, using regular move");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupEx) {
            log.warn("[Storage] Failed to clean up temp file {}: {}", temp, cleanupEx.getMessage());
        }
    }

    private Path resolveDirectory(String directory) {
        return guard(sessionsRoot.resolve(directory).normalize(), directory);
    }

    private Path resolvePath(String directory, String path) {
        return guard(sessionsRoot.resolve(directory).resolve(path).normalize(), directory + "/" + path);
    }

    private Path guard(Path resolved, String requested) {
        if (!resolved.startsWith(sessionsRoot)) {
            throw new IllegalArgumentException("Path traversal blocked: " + requested);
        }
        return resolved;
    }
}
