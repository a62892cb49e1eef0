package io.taskqueue.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("taskqueue-worker-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertEquals("taskqueue-worker-1", t1.getName());
        assertEquals("taskqueue-worker-2", t2.getName());
    }

    @Test
    void installsUncaughtExceptionHandler() {
        Thread thread = new DaemonThreadFactory("x-").newThread(() -> {
        });

        assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
