package me.golemcore.patches.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import me.golemcore.patches.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Numbered patch documents of the active session, stored under
 * {@code <session>/patches/}.
 *
 * <p>
 * With no session bound every read answers empty/false/0 and writes are
 * skipped, so callers never need a separate no-session branch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatchFileStore {

    public static final Pattern PATCH_FILE_PATTERN = Pattern.compile("^patch_\\d+\\.diff$");
    private static final String PATCH_PREFIX = "patch_";
    private static final String PATCH_EXTENSION = ".diff";

    private final StoragePort storagePort;
    private final PatchProperties properties;

    private volatile String directory;

    /**
     * Point the store at a session, or detach it with {@code null}.
     */
    public void bindSession(String sessionId) {
        this.directory = sessionId == null
                ? null
                : sessionId + "/" + properties.getStorage().getPatchesDirectory();
    }

    /**
     * Directory relative to the sessions root, {@code null} without a session.
     */
    public String getDirectory() {
        return directory;
    }

    public boolean isBound() {
        return directory != null;
    }

    public void ensureDirectory() {
        String dir = directory;
        if (dir == null) {
            return;
        }
        storagePort.ensureDirectory(dir).join();
    }

    public String filenameFor(int patchNumber) {
        String digits = String.valueOf(patchNumber);
        int padding = properties.getNumberPadding();
        StringBuilder sb = new StringBuilder(PATCH_PREFIX);
        for (int i = digits.length(); i < padding; i++) {
            sb.append('0');
        }
        return sb.append(digits).append(PATCH_EXTENSION).toString();
    }

    /**
     * Write a patch document atomically.
     *
     * @return the file name, or empty when no session is bound
     */
    public Optional<String> write(int patchNumber, String content) {
        String dir = directory;
        if (dir == null) {
            return Optional.empty();
        }
        String name = filenameFor(patchNumber);
        storagePort.putTextAtomic(dir, name, content).join();
        log.debug("[Storage] Wrote {}/{} ({} chars)", dir, name, content.length());
        return Optional.of(name);
    }

    public Optional<String> read(String name) {
        String dir = directory;
        if (dir == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(storagePort.getText(dir, name).join());
        } catch (RuntimeException e) { // NOSONAR - unreadable document is reported as missing
            log.warn("[Storage] Failed to read {}/{}: {}", dir, name, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean delete(String name) {
        String dir = directory;
        if (dir == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(storagePort.deleteObject(dir, name).join());
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Storage] Failed to delete {}/{}: {}", dir, name, e.getMessage());
            return false;
        }
    }

    public boolean exists(String name) {
        String dir = directory;
        if (dir == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(storagePort.exists(dir, name).join());
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Storage] Failed to check {}/{}: {}", dir, name, e.getMessage());
            return false;
        }
    }

    public long sizeOf(String name) {
        String dir = directory;
        if (dir == null) {
            return 0L;
        }
        try {
            Long size = storagePort.sizeOf(dir, name).join();
            return size != null ? size : 0L;
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Storage] Failed to stat {}/{}: {}", dir, name, e.getMessage());
            return 0L;
        }
    }

    /**
     * Total size of all patch documents in the session directory.
     */
    public long totalSize() {
        long total = 0;
        for (String name : listPatchFiles()) {
            total += sizeOf(name);
        }
        return total;
    }

    /**
     * Names of files matching {@code patch_<digits>.diff}, whatever their
     * padding.
     */
    public List<String> listPatchFiles() {
        return listFiles().stream()
                .filter(name -> PATCH_FILE_PATTERN.matcher(name).matches())
                .toList();
    }

    public List<String> listFiles() {
        String dir = directory;
        if (dir == null) {
            return Collections.emptyList();
        }
        try {
            List<String> names = storagePort.listObjects(dir).join();
            return names != null ? names : Collections.emptyList();
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Storage] Failed to list {}: {}", dir, e.getMessage());
            return Collections.emptyList();
        }
    }
}
