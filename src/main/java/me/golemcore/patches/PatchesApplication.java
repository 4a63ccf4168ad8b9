package me.golemcore.patches;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Patches.
 *
 * <p>
 * GolemCore Patches is the undo subsystem of the agent: every file-mutating
 * operation performed by a tool is captured as a reversible unified diff, so
 * the user or the agent can later undo one, several, or all operations since a
 * point in time.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Capture</b> - write, edit, line edit and delete operations stored as
 * numbered patch documents per session</li>
 * <li><b>Undo</b> - last N, single patch, or everything since a timestamp,
 * the history only changes when the whole batch reverted</li>
 * <li><b>Preview</b> - side-effect-free simulation of any undo</li>
 * <li><b>Retention</b> - count and size limits, oldest evicted first</li>
 * <li><b>Integrity</b> - corrupted and orphaned state quarantined on every
 * session switch</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → UndoPort, FileSystemTool, UndoTool
 * Domain Layer       → PatchManager, PatchIndex, DiffCodec, PatchApplier
 * Infrastructure     → Local storage and workspace file adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code patches.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PatchesApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatchesApplication.class, args);
    }

}
