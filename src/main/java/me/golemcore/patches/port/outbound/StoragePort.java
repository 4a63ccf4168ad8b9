package me.golemcore.patches.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage under the sessions root. Directories are
 * relative to the root (e.g. {@code "<session>/patches"} or
 * {@code ".quarantine"}), paths are relative to their directory.
 *
 * <p>
 * I/O failures complete the returned future exceptionally; paths escaping the
 * root fail with {@link IllegalArgumentException}.
 */
public interface StoragePort {

    /**
     * Write a file so that readers see either the old or the new content,
     * never a partial one. Parent directories are created.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Read text content from file, {@code null} when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Whether a regular file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Completes with {@code true} when a file was removed.
     */
    CompletableFuture<Boolean> deleteObject(String directory, String path);

    /**
     * List regular files directly inside a directory (names only, sorted).
     */
    CompletableFuture<List<String>> listObjects(String directory);

    /**
     * Size of a file in bytes, 0 when missing.
     */
    CompletableFuture<Long> sizeOf(String directory, String path);

    /**
     * Move a file to another directory under the root, creating the target
     * directory when needed.
     */
    CompletableFuture<Void> moveObject(String directory, String path, String targetDirectory, String targetPath);

    /**
     * Recursively delete a directory. Missing directories are ignored.
     */
    CompletableFuture<Void> deleteDirectory(String directory);

    CompletableFuture<Void> ensureDirectory(String directory);
}
