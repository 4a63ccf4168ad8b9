package me.golemcore.patches.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PatchQueueConfigurationTest {

    @Test
    void executorRunsOnSingleDaemonThread() throws Exception {
        PatchQueueConfiguration configuration = new PatchQueueConfiguration();
        ExecutorService executor = configuration.patchQueueExecutor();

        Thread thread = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertEquals("patch-queue", thread.getName());
        assertTrue(thread.isDaemon());
        assertSame(executor, configuration.patchQueueExecutor());

        configuration.shutdown();
        assertTrue(executor.isShutdown());
    }

    @Test
    void shutdownWithoutExecutorIsNoOp() {
        assertDoesNotThrow(() -> new PatchQueueConfiguration().shutdown());
    }

    @Test
    void propertiesHaveSensibleDefaults() {
        PatchProperties properties = new PatchProperties();

        assertEquals(3, properties.getDiff().getContextLines());
        assertEquals(100, properties.getRetention().getMaxPatches());
        assertEquals(10L * 1024 * 1024, properties.getRetention().getMaxSizeBytes());
        assertEquals("patches", properties.getStorage().getPatchesDirectory());
        assertEquals("patch_index.json", properties.getStorage().getIndexFile());
        assertEquals(".quarantine", properties.getStorage().getQuarantineDirectory());
        assertEquals(3, properties.getNumberPadding());
    }
}
