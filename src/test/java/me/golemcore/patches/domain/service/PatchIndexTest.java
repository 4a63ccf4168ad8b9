package me.golemcore.patches.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.patches.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.patches.domain.model.PatchMetadata;
import me.golemcore.patches.infrastructure.config.PatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PatchIndexTest {

    private static final String SESSION = "s1";
    private static final String EDIT = "edit";
    private static final String WRITE = "write";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private PatchProperties properties;
    private ObjectMapper objectMapper;
    private PatchIndex index;

    @BeforeEach
    void setUp() {
        properties = new PatchProperties();
        properties.getStorage().setSessionsPath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = new ObjectMapper();
        index = newIndex();
        index.bindSession(SESSION);
    }

    private PatchIndex newIndex() {
        return new PatchIndex(storage, new PatchIndexValidator(objectMapper), objectMapper, properties);
    }

    private Path indexFile() {
        return tempDir.resolve(SESSION).resolve("patches").resolve("patch_index.json");
    }

    private void addPatch(String operation, String timestamp) {
        int number = index.nextNumber();
        index.add(PatchMetadata.builder()
                .patchNumber(number)
                .timestamp(timestamp)
                .operationType(operation)
                .filePath("/work/file" + number + ".txt")
                .patchFile(String.format("patch_%03d.diff", number))
                .build());
        index.incrementNumber();
    }

    // ==================== load / save ====================

    @Test
    void loadWithoutFileGivesFreshIndex() {
        index.load();

        assertEquals(0, index.count());
        assertEquals(1, index.nextNumber());
    }

    @Test
    void saveAndReloadPreservesEntriesAndCounter() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");
        index.remove(2);
        index.save();

        PatchIndex reloaded = newIndex();
        reloaded.bindSession(SESSION);
        reloaded.load();

        assertEquals(1, reloaded.count());
        assertEquals(3, reloaded.nextNumber());
        assertEquals("/work/file1.txt", reloaded.get(1).orElseThrow().getFilePath());
    }

    @Test
    void savedIndexUsesSnakeCaseFields() throws IOException {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        index.save();

        String json = Files.readString(indexFile(), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"next_patch_number\""));
        assertTrue(json.contains("\"patch_number\""));
        assertTrue(json.contains("\"operation_type\""));
        assertTrue(json.contains("\"file_path\""));
        assertTrue(json.contains("\"patch_file\""));
    }

    @Test
    void corruptJsonResetsToFreshIndex() throws IOException {
        Files.createDirectories(indexFile().getParent());
        Files.writeString(indexFile(), "{ not json");

        index.load();

        assertEquals(0, index.count());
        assertEquals(1, index.nextNumber());
    }

    @Test
    void structurallyInvalidIndexResetsToFreshIndex() throws IOException {
        Files.createDirectories(indexFile().getParent());
        Files.writeString(indexFile(), "{\"next_patch_number\": \"five\", \"patches\": []}");

        index.load();

        assertEquals(0, index.count());
        assertEquals(1, index.nextNumber());
    }

    @Test
    void loadRaisesNextNumberAboveStoredEntries() throws IOException {
        Files.createDirectories(indexFile().getParent());
        Files.writeString(indexFile(), """
                {"next_patch_number": 1, "patches": [
                  {"patch_number": 1, "timestamp": "2026-01-15T10:00:00Z", "operation_type": "write",
                   "file_path": "/work/file1.txt", "patch_file": "patch_001.diff"},
                  {"patch_number": 4, "timestamp": "2026-01-15T10:01:00Z", "operation_type": "edit",
                   "file_path": "/work/file4.txt", "patch_file": "patch_004.diff"}
                ]}
                """);

        index.load();

        assertEquals(2, index.count());
        assertEquals(5, index.nextNumber());
    }

    @Test
    void negativeNextNumberResetsToFreshIndex() throws IOException {
        Files.createDirectories(indexFile().getParent());
        Files.writeString(indexFile(), "{\"next_patch_number\": -5, \"patches\": []}");

        index.load();

        assertEquals(0, index.count());
        assertEquals(1, index.nextNumber());
    }

    @Test
    void saveRefusesInvalidIndex() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        index.get(1).orElseThrow().setTimestamp(null);

        assertThrows(IllegalStateException.class, () -> index.save());
        assertFalse(Files.exists(indexFile()));
    }

    @Test
    void addRejectsInvalidOrDuplicateMetadata() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");

        PatchMetadata missingFields = PatchMetadata.builder().patchNumber(5).build();
        PatchMetadata duplicate = index.get(1).orElseThrow().toBuilder().build();

        assertThrows(IllegalArgumentException.class, () -> index.add(missingFields));
        assertThrows(IllegalArgumentException.class, () -> index.add(duplicate));
    }

    // ==================== removal ====================

    @Test
    void removeVariantsKeepCounterMonotonic() {
        for (int i = 0; i < 6; i++) {
            addPatch(WRITE, "2026-01-15T10:0" + i + ":00Z");
        }

        assertTrue(index.remove(3));
        assertFalse(index.remove(3));
        assertEquals(2, index.removeMany(Set.of(1, 5, 42)));
        assertEquals(List.of(6), numbers(index.removeLast(1)));
        assertEquals(List.of(2), numbers(index.removeFirst(1)));
        assertEquals(List.of(4), numbers(index.all()));
        assertEquals(7, index.nextNumber());
    }

    @Test
    void removeLastAndFirstClampToAvailable() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");

        assertEquals(List.of(1, 2), numbers(index.removeLast(10)));
        assertTrue(index.removeFirst(3).isEmpty());
    }

    // ==================== queries ====================

    @Test
    void lastReturnsNewestInChronologicalOrder() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");
        addPatch(EDIT, "2026-01-15T10:02:00Z");

        assertEquals(List.of(2, 3), numbers(index.last(2)));
        assertEquals(List.of(1, 2, 3), numbers(index.last(9)));
    }

    @Test
    void sinceIncludesBoundaryAndSkipsInvalidTimestamps() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "yesterday-ish");
        addPatch(EDIT, "2026-01-15T10:05:00Z");
        addPatch(EDIT, "2026-01-15T10:10:00Z");

        List<PatchMetadata> since = index.since(Instant.parse("2026-01-15T10:05:00Z"));

        assertEquals(List.of(3, 4), numbers(since));
    }

    @Test
    void historyIsNewestFirstWithOptionalLimit() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");
        addPatch(EDIT, "2026-01-15T10:02:00Z");

        assertEquals(List.of(3, 2, 1), numbers(index.history(null)));
        assertEquals(List.of(3, 2), numbers(index.history(2)));
    }

    @Test
    void operationCountsGroupByType() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");
        addPatch(EDIT, "2026-01-15T10:02:00Z");

        assertEquals(Map.of(WRITE, 1, EDIT, 2), index.operationCounts());
    }

    @Test
    void updateChangesOnlyGivenFields() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");

        boolean updated = index.update(1, PatchMetadata.builder().operationType(EDIT).build());

        assertTrue(updated);
        PatchMetadata patch = index.get(1).orElseThrow();
        assertEquals(EDIT, patch.getOperationType());
        assertEquals("/work/file1.txt", patch.getFilePath());
        assertEquals("patch_001.diff", patch.getPatchFile());
        assertFalse(index.update(99, PatchMetadata.builder().operationType(EDIT).build()));
    }

    @Test
    void clearResetsNumbering() {
        addPatch(WRITE, "2026-01-15T10:00:00Z");
        addPatch(EDIT, "2026-01-15T10:01:00Z");

        index.clear();

        assertEquals(0, index.count());
        assertEquals(1, index.nextNumber());
    }

    @Test
    void unboundIndexDoesNotPersist() {
        PatchIndex unbound = newIndex();

        unbound.load();
        unbound.save();

        assertNull(unbound.getDirectory());
        assertFalse(Files.exists(indexFile()));
    }

    private static List<Integer> numbers(List<PatchMetadata> patches) {
        return patches.stream().map(PatchMetadata::getPatchNumber).toList();
    }
}
