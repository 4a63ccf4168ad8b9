package me.golemcore.patches.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Summary of the active session's patch history.
 */
@Data
@Builder
public class PatchStats {

    @JsonProperty("patches_directory")
    private String patchesDirectory;

    @JsonProperty("total_patches")
    private int totalPatches;

    @JsonProperty("operation_counts")
    @Builder.Default
    private Map<String, Integer> operationCounts = Map.of();

    @JsonProperty("total_size_bytes")
    private long totalSizeBytes;

    @JsonProperty("next_patch_number")
    private int nextPatchNumber;

    public static PatchStats empty() {
        return PatchStats.builder()
                .nextPatchNumber(1)
                .build();
    }
}
