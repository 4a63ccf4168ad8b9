package me.golemcore.patches.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the patch subsystem, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code patches.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - sessions root and on-disk layout</li>
 * <li>{@link DiffProperties} - unified diff generation</li>
 * <li>{@link RetentionProperties} - count and size limits</li>
 * <li>{@link ToolsProperties} - tools that capture operations</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "patches")
@Data
public class PatchProperties {

    private StorageProperties storage = new StorageProperties();
    private DiffProperties diff = new DiffProperties();
    private RetentionProperties retention = new RetentionProperties();
    private ToolsProperties tools = new ToolsProperties();
    private int numberPadding = 3;

    @Data
    public static class StorageProperties {
        private String sessionsPath = "${user.home}/.golemcore/sessions";
        private String patchesDirectory = "patches";
        private String indexFile = "patch_index.json";
        private String quarantineDirectory = ".quarantine";
    }

    @Data
    public static class DiffProperties {
        private int contextLines = 3;
    }

    @Data
    public static class RetentionProperties {
        private int maxPatches = 100;
        private long maxSizeBytes = 10L * 1024 * 1024;
        // evicted after each capture when set
        private Duration maxAge;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private FileSystemToolProperties filesystem = new FileSystemToolProperties();
        private UndoToolProperties undo = new UndoToolProperties();
    }

    @Data
    public static class FileSystemToolProperties {
        private boolean enabled = true;
        private String workspace = "${user.home}/.golemcore/sandbox";
    }

    @Data
    public static class UndoToolProperties {
        private boolean enabled = true;
        private int defaultListLimit = 10;
    }
}
