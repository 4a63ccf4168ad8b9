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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an undo call.
 *
 * <p>
 * {@code success} is true only when at least one file was reverted and nothing
 * failed. An empty result with a single failure message means "nothing to do";
 * reverted files together with failures mean the batch stopped part way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UndoResult {

    public static final String INVALID_STRUCTURE = "Internal error: invalid result structure";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    @JsonProperty("success")
    private boolean success;

    @JsonProperty("reverted_files")
    @Builder.Default
    private List<String> revertedFiles = new ArrayList<>();

    @JsonProperty("failed_operations")
    @Builder.Default
    private List<String> failedOperations = new ArrayList<>();

    public static UndoResult of(List<String> revertedFiles, List<String> failedOperations) {
        return UndoResult.builder()
                .success(!revertedFiles.isEmpty() && failedOperations.isEmpty())
                .revertedFiles(new ArrayList<>(revertedFiles))
                .failedOperations(new ArrayList<>(failedOperations))
                .build();
    }

    public static UndoResult failure(String reason) {
        List<String> failures = new ArrayList<>();
        failures.add(reason);
        return UndoResult.builder()
                .success(false)
                .failedOperations(failures)
                .build();
    }

    @JsonIgnore
    public boolean isValid() {
        if (revertedFiles == null || failedOperations == null) {
            return false;
        }
        if (revertedFiles.stream().anyMatch(f -> f == null)
                || failedOperations.stream().anyMatch(f -> f == null)) {
            return false;
        }
        boolean expected = !revertedFiles.isEmpty() && failedOperations.isEmpty();
        return success == expected;
    }
}
