package me.golemcore.patches.domain.service;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.patches.domain.model.PatchIndexDocument;
import me.golemcore.patches.domain.model.PatchMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on the patch index before it is trusted or persisted.
 *
 * <p>
 * Works on the JSON tree so that a wrongly typed field is reported instead of
 * being coerced by data binding. Patch numbers and {@code next_patch_number}
 * must be integers of at least 1, patch numbers must be unique and
 * {@code next_patch_number} must be greater than all of them.
 */
@Component
@RequiredArgsConstructor
public class PatchIndexValidator {

    private static final String NEXT_PATCH_NUMBER = "next_patch_number";
    private static final String PATCHES = "patches";
    private static final String PATCH_NUMBER = "patch_number";
    private static final List<String> TEXT_FIELDS = List.of("timestamp", "operation_type", "file_path", "patch_file");

    private final ObjectMapper objectMapper;

    /**
     * @return problems found, empty when the index is valid
     */
    public List<String> validate(JsonNode index) {
        List<String> errors = validateStructure(index);
        if (errors.isEmpty()) {
            int next = index.get(NEXT_PATCH_NUMBER).intValue();
            int max = maxPatchNumber(index);
            if (next <= max) {
                errors.add(NEXT_PATCH_NUMBER + " (" + next + ") must be greater than the highest "
                        + PATCH_NUMBER + " (" + max + ")");
            }
        }
        return errors;
    }

    /**
     * Same as {@link #validate(JsonNode)} without the check of
     * {@code next_patch_number} against the entries, which a loader can
     * repair.
     */
    public List<String> validateStructure(JsonNode index) {
        List<String> errors = new ArrayList<>();
        if (index == null || !index.isObject()) {
            errors.add("index must be a JSON object");
            return errors;
        }
        if (!isPositiveInt(index.get(NEXT_PATCH_NUMBER))) {
            errors.add(NEXT_PATCH_NUMBER + " must be an integer >= 1");
        }
        JsonNode patches = index.get(PATCHES);
        if (patches == null || !patches.isArray()) {
            errors.add(PATCHES + " must be an array");
            return errors;
        }
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < patches.size(); i++) {
            JsonNode entry = patches.get(i);
            List<String> entryErrors = validateEntry(entry, i);
            if (entryErrors.isEmpty() && !seen.add(entry.get(PATCH_NUMBER).intValue())) {
                entryErrors.add("patches[" + i + "]." + PATCH_NUMBER + " duplicates "
                        + entry.get(PATCH_NUMBER).intValue());
            }
            errors.addAll(entryErrors);
        }
        return errors;
    }

    /**
     * Highest {@code patch_number} of a structurally valid index, 0 when it
     * has no entries.
     */
    public int maxPatchNumber(JsonNode index) {
        int max = 0;
        for (JsonNode entry : index.get(PATCHES)) {
            max = Math.max(max, entry.get(PATCH_NUMBER).intValue());
        }
        return max;
    }

    public List<String> validate(PatchIndexDocument document) {
        return validate(objectMapper.valueToTree(document));
    }

    public boolean isValid(PatchMetadata metadata) {
        return metadata != null && validateEntry(objectMapper.valueToTree(metadata), 0).isEmpty();
    }

    private List<String> validateEntry(JsonNode entry, int position) {
        List<String> errors = new ArrayList<>();
        String where = "patches[" + position + "]";
        if (entry == null || !entry.isObject()) {
            errors.add(where + " must be an object");
            return errors;
        }
        JsonNode number = entry.get(PATCH_NUMBER);
        if (!isPositiveInt(number)) {
            errors.add(where + "." + PATCH_NUMBER + " must be an integer >= 1");
        }
        for (String field : TEXT_FIELDS) {
            JsonNode value = entry.get(field);
            if (value == null || !value.isTextual()) {
                errors.add(where + "." + field + " must be a string");
            }
        }
        return errors;
    }

    private static boolean isPositiveInt(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToInt() && node.intValue() >= 1;
    }
}
