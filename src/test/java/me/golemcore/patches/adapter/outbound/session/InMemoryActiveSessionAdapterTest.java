package me.golemcore.patches.adapter.outbound.session;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryActiveSessionAdapterTest {

    @Test
    void startsWithoutSession() {
        assertEquals(Optional.empty(), new InMemoryActiveSessionAdapter().getActiveSessionId());
    }

    @Test
    void activateAndDeactivate() {
        InMemoryActiveSessionAdapter adapter = new InMemoryActiveSessionAdapter();

        adapter.activate("s1");
        assertEquals(Optional.of("s1"), adapter.getActiveSessionId());

        adapter.activate("s2");
        assertEquals(Optional.of("s2"), adapter.getActiveSessionId());

        adapter.deactivate();
        assertEquals(Optional.empty(), adapter.getActiveSessionId());
    }

    @Test
    void rejectsBlankSessionId() {
        InMemoryActiveSessionAdapter adapter = new InMemoryActiveSessionAdapter();

        assertThrows(IllegalArgumentException.class, () -> adapter.activate(" "));
        assertThrows(IllegalArgumentException.class, () -> adapter.activate(null));
    }
}
