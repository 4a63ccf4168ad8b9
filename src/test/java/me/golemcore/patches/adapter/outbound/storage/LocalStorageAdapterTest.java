package me.golemcore.patches.adapter.outbound.storage;

import me.golemcore.patches.infrastructure.config.PatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "s1/patches";
    private static final String CONTENT_DEFAULT = "content";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        PatchProperties properties = new PatchProperties();
        properties.getStorage().setSessionsPath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "patch_001.diff", "Hello, World!").get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "patch_001.diff").get());
    }

    @Test
    void getText_returnsNullForNonExisting() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.diff").get());
    }

    @Test
    void exists_returnsFalseForDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory(TEST_DIR + "/nested").get();

        assertFalse(storageAdapter.exists(TEST_DIR, "nested").get());
        assertTrue(Files.isDirectory(tempDir.resolve(TEST_DIR).resolve("nested")));
    }

    @Test
    void deleteObject_reportsWhetherFileWasRemoved() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "to-delete.txt", CONTENT_DEFAULT).get();

        assertTrue(storageAdapter.deleteObject(TEST_DIR, "to-delete.txt").get());
        assertFalse(storageAdapter.exists(TEST_DIR, "to-delete.txt").get());
        assertFalse(storageAdapter.deleteObject(TEST_DIR, "to-delete.txt").get());
    }

    // ==================== Listing and sizes ====================

    @Test
    void listObjects_returnsSortedFileNamesOnly() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "patch_002.diff", "b").get();
        storageAdapter.putTextAtomic(TEST_DIR, "patch_001.diff", "a").get();
        storageAdapter.ensureDirectory(TEST_DIR + "/sub").get();

        assertEquals(List.of("patch_001.diff", "patch_002.diff"), storageAdapter.listObjects(TEST_DIR).get());
    }

    @Test
    void listObjects_returnsEmptyListForNonExistentDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("non-existent-dir").get().isEmpty());
    }

    @Test
    void sizeOf_returnsBytesOrZero() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "sized.diff", "12345").get();

        assertEquals(5L, storageAdapter.sizeOf(TEST_DIR, "sized.diff").get());
        assertEquals(0L, storageAdapter.sizeOf(TEST_DIR, "missing.diff").get());
    }

    // ==================== Move and delete directory ====================

    @Test
    void moveObject_createsTargetDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "patch_9999.diff", "stray").get();

        storageAdapter.moveObject(TEST_DIR, "patch_9999.diff", ".quarantine/orphaned", "patch_9999.diff").get();

        assertFalse(storageAdapter.exists(TEST_DIR, "patch_9999.diff").get());
        assertEquals("stray", storageAdapter.getText(".quarantine/orphaned", "patch_9999.diff").get());
    }

    @Test
    void deleteDirectory_removesTreeAndIgnoresMissing() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "a.diff", "a").get();
        storageAdapter.putTextAtomic(TEST_DIR + "/deep", "b.diff", "b").get();

        storageAdapter.deleteDirectory(TEST_DIR).get();
        storageAdapter.deleteDirectory("never-existed").get();

        assertFalse(Files.exists(tempDir.resolve(TEST_DIR)));
        assertTrue(Files.exists(tempDir.resolve("s1")));
    }

    @Test
    void deleteDirectory_refusesStorageRoot() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.deleteDirectory(".").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    // ==================== Path traversal ====================

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic("test", "../../etc/passwd", "hack").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnGet() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText("test", "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockDirectoryTraversalOnDelete() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.deleteDirectory("../outside").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    // ==================== Atomic writes ====================

    @Test
    void putTextAtomic_overwritesAndLeavesNoTempFile() throws ExecutionException, InterruptedException {
        String path = "patch_001.diff";

        storageAdapter.putTextAtomic(TEST_DIR, path, "first").get();
        storageAdapter.putTextAtomic(TEST_DIR, path, "second").get();

        assertEquals("second", storageAdapter.getText(TEST_DIR, path).get());
        assertFalse(storageAdapter.exists(TEST_DIR, path + ".tmp").get());
    }

    @Test
    void putTextAtomic_createsParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("fresh/session/patches", "patch_001.diff", "diff").get();

        assertEquals("diff", storageAdapter.getText("fresh/session/patches", "patch_001.diff").get());
    }
}
