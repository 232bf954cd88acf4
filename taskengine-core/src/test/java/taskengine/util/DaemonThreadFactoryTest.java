package taskengine.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsDaemonThreadsWithSequentialNames() {
        DaemonThreadFactory factory = new DaemonThreadFactory("taskengine-serial-");

        Thread t1 = factory.newThread(() -> {
        });
        Thread t2 = factory.newThread(() -> {
        });

        assertTrue(t1.isDaemon());
        assertTrue(t2.isDaemon());
        assertEquals("taskengine-serial-1", t1.getName());
        assertEquals("taskengine-serial-2", t2.getName());
    }

    @Test
    void installsUncaughtExceptionHandler() {
        Thread thread = new DaemonThreadFactory("x-").newThread(() -> {
        });

        assertNotNull(thread.getUncaughtExceptionHandler());
        assertTrue(thread.getUncaughtExceptionHandler() != thread.getThreadGroup());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
