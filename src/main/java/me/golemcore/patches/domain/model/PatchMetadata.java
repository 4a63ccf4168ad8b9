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

/**
 * One captured file-mutating operation as recorded in the patch index.
 *
 * <p>
 * {@code patchFile} is derived from {@code patchNumber} at capture time
 * ({@code patch_007.diff}). {@code timestamp} is an ISO-8601 instant and drives
 * ordering and range queries.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PatchMetadata {

    @JsonProperty("patch_number")
    private int patchNumber;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("operation_type")
    private String operationType;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("patch_file")
    private String patchFile;
}
