package me.golemcore.patches.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.patches.domain.model.PatchIndexDocument;
import me.golemcore.patches.domain.model.PatchMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchIndexValidatorTest {

    private ObjectMapper objectMapper;
    private PatchIndexValidator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        validator = new PatchIndexValidator(objectMapper);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void acceptsWellFormedIndex() throws Exception {
        JsonNode index = json("""
                {"next_patch_number": 3, "patches": [
                  {"patch_number": 2, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "edit",
                   "file_path": "/work/a.txt", "patch_file": "patch_002.diff"}
                ]}
                """);

        assertTrue(validator.validate(index).isEmpty());
    }

    @Test
    void rejectsNonObjectRoot() throws Exception {
        assertFalse(validator.validate(json("[]")).isEmpty());
        assertFalse(validator.validate((JsonNode) null).isEmpty());
    }

    @Test
    void rejectsWrongTopLevelTypes() throws Exception {
        List<String> errors = validator.validate(json("{\"next_patch_number\": \"1\", \"patches\": {}}"));

        assertEquals(2, errors.size());
        assertTrue(errors.get(0).contains("next_patch_number"));
        assertTrue(errors.get(1).contains("patches"));
    }

    @Test
    void reportsEachInvalidEntryField() throws Exception {
        List<String> errors = validator.validate(json("""
                {"next_patch_number": 2, "patches": [
                  {"patch_number": "1", "timestamp": 5, "operation_type": "edit",
                   "file_path": "/work/a.txt"}
                ]}
                """));

        assertEquals(3, errors.size());
        assertTrue(errors.contains("patches[0].patch_number must be an integer >= 1"));
        assertTrue(errors.contains("patches[0].timestamp must be a string"));
        assertTrue(errors.contains("patches[0].patch_file must be a string"));
    }

    @Test
    void rejectsNonPositiveOrFractionalNumbers() throws Exception {
        assertFalse(validator.validate(json("{\"next_patch_number\": -5, \"patches\": []}")).isEmpty());
        assertFalse(validator.validate(json("{\"next_patch_number\": 0, \"patches\": []}")).isEmpty());
        assertFalse(validator.validate(json("{\"next_patch_number\": 2.5, \"patches\": []}")).isEmpty());

        List<String> errors = validator.validate(json("""
                {"next_patch_number": 4, "patches": [
                  {"patch_number": 1.5, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "edit",
                   "file_path": "/work/a.txt", "patch_file": "patch_001.diff"},
                  {"patch_number": 0, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "edit",
                   "file_path": "/work/b.txt", "patch_file": "patch_000.diff"}
                ]}
                """));

        assertEquals(List.of("patches[0].patch_number must be an integer >= 1",
                "patches[1].patch_number must be an integer >= 1"), errors);
    }

    @Test
    void rejectsDuplicatePatchNumbers() throws Exception {
        List<String> errors = validator.validate(json("""
                {"next_patch_number": 3, "patches": [
                  {"patch_number": 2, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "edit",
                   "file_path": "/work/a.txt", "patch_file": "patch_002.diff"},
                  {"patch_number": 2, "timestamp": "2026-01-15T10:01:00Z", "operation_type": "edit",
                   "file_path": "/work/b.txt", "patch_file": "patch_002.diff"}
                ]}
                """));

        assertEquals(List.of("patches[1].patch_number duplicates 2"), errors);
    }

    @Test
    void nextNumberMustExceedEveryPatchNumber() throws Exception {
        JsonNode index = json("""
                {"next_patch_number": 2, "patches": [
                  {"patch_number": 2, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "edit",
                   "file_path": "/work/a.txt", "patch_file": "patch_002.diff"}
                ]}
                """);

        assertEquals(List.of("next_patch_number (2) must be greater than the highest patch_number (2)"),
                validator.validate(index));
        assertTrue(validator.validateStructure(index).isEmpty());
        assertEquals(2, validator.maxPatchNumber(index));
    }

    @Test
    void validatesInMemoryDocumentAndMetadata() {
        PatchMetadata valid = PatchMetadata.builder()
                .patchNumber(1)
                .timestamp("2026-01-15T10:00:00Z")
                .operationType("write")
                .filePath("/work/a.txt")
                .patchFile("patch_001.diff")
                .build();
        PatchIndexDocument document = PatchIndexDocument.builder()
                .nextPatchNumber(2)
                .patches(new java.util.ArrayList<>(List.of(valid)))
                .build();

        assertTrue(validator.validate(document).isEmpty());
        assertTrue(validator.isValid(valid));
        assertFalse(validator.isValid(valid.toBuilder().filePath(null).build()));
        assertFalse(validator.isValid(null));
    }
}
