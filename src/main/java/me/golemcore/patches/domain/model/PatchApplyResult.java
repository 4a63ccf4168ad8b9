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

import lombok.Builder;
import lombok.Data;

/**
 * Result of applying a unified diff to a string. Either {@code content} or
 * {@code error} is set.
 */
@Data
@Builder
public class PatchApplyResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String content;
    private String error;

    public static PatchApplyResult success(String content) {
        return PatchApplyResult.builder()
                .success(true)
                .content(content)
                .build();
    }

    public static PatchApplyResult failure(String error) {
        return PatchApplyResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
