package club.ppmc.runner.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.runner.model.ExecutionSession;
import org.junit.jupiter.api.Test;

class SessionTableTest {

    private final SessionTable table = new SessionTable();

    @Test
    void shouldReturnReplacedSession() {
        var first = session("c1");
        var second = session("c1");

        assertNull(table.register(first));
        assertSame(first, table.register(second));
        assertSame(second, table.get("c1"));
        assertEquals(1, table.size());
    }

    @Test
    void shouldOnlyRemoveMatchingInstance() {
        var stale = session("c1");
        var current = session("c1");
        table.register(current);

        assertFalse(table.remove("c1", stale));
        assertSame(current, table.get("c1"));
        assertTrue(table.remove("c1", current));
        assertNull(table.get("c1"));
    }

    @Test
    void shouldKeepClientsIndependent() {
        table.register(session("c1"));
        table.register(session("c2"));

        assertEquals(2, table.snapshot().size());
        table.remove("c1", table.get("c1"));
        assertEquals(1, table.size());
        assertEquals("c2", table.snapshot().iterator().next().getSessionId());
    }

    private static ExecutionSession session(String sessionId) {
        return new ExecutionSession(sessionId, "python", null, null, null);
    }
}
