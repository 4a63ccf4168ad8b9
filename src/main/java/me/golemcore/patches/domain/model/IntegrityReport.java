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

import java.util.ArrayList;
import java.util.List;

/**
 * What an integrity pass found and moved aside.
 */
@Data
@Builder
public class IntegrityReport {

    @Builder.Default
    private List<Integer> corruptedPatches = new ArrayList<>();

    @Builder.Default
    private List<String> orphanedFiles = new ArrayList<>();

    @Builder.Default
    private List<String> failedMoves = new ArrayList<>();

    @Builder.Default
    private List<String> removedTempFiles = new ArrayList<>();

    public static IntegrityReport clean() {
        return IntegrityReport.builder().build();
    }

    public boolean isClean() {
        return corruptedPatches.isEmpty() && orphanedFiles.isEmpty();
    }
}
