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
 * What a file would look like after undoing one patch. Produced without
 * touching the file or the index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UndoPreview {

    @JsonProperty("operation_type")
    private String operationType;

    @JsonProperty("file_path")
    private String filePath;

    @JsonProperty("patch_number")
    private int patchNumber;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("current_content")
    private String currentContent;

    @JsonProperty("predicted_content")
    private String predictedContent;
}
