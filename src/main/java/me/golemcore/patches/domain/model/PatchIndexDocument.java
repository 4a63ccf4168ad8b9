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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of {@code patch_index.json}. Patches are kept in insertion
 * order, oldest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatchIndexDocument {

    @JsonProperty("next_patch_number")
    @Builder.Default
    private int nextPatchNumber = 1;

    @JsonProperty("patches")
    @Builder.Default
    private List<PatchMetadata> patches = new ArrayList<>();

    public static PatchIndexDocument empty() {
        return PatchIndexDocument.builder().build();
    }
}
