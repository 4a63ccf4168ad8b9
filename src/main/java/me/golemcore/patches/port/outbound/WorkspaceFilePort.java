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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for the files the agent edits, addressed by absolute path. Used when a
 * patch is reverted or previewed.
 */
public interface WorkspaceFilePort {

    /**
     * Read a file as UTF-8 text.
     *
     * @return the content, or empty when the file does not exist
     */
    Optional<String> readText(Path file) throws IOException;

    boolean exists(Path file);

    /**
     * Replace the file content via a temporary sibling file and a rename,
     * creating parent directories when needed.
     */
    void writeTextAtomic(Path file, String content) throws IOException;

    void delete(Path file) throws IOException;
}
