package inspector.coordinator.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KeyedDebouncerTest {

    private final KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(Duration.ofMillis(100), "debounce-test");

    @AfterEach
    void close() {
        debouncer.close();
    }

    @Test
    void lastSubmissionPerKeyWins() throws Exception {
        List<String> ran = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(2);

        debouncer.submit("a", () -> { ran.add("a1"); done.countDown(); });
        debouncer.submit("a", () -> { ran.add("a2"); done.countDown(); });
        debouncer.submit("b", () -> { ran.add("b1"); done.countDown(); });

        assertTrue(done.await(2, TimeUnit.SECONDS));
        Thread.sleep(150);
        assertEquals(2, ran.size());
        assertTrue(ran.contains("a2"));
        assertTrue(ran.contains("b1"));
        assertEquals(0, debouncer.pendingCount());
    }

    @Test
    void cancelledActionsNeverRun() throws Exception {
        List<String> ran = new CopyOnWriteArrayList<>();

        debouncer.submit("a", () -> ran.add("a"));
        debouncer.submit("b", () -> ran.add("b"));
        debouncer.submit("c", () -> ran.add("c"));
        assertEquals(3, debouncer.pendingCount());

        assertTrue(debouncer.cancel("a"));
        assertFalse(debouncer.cancel("missing"));
        assertEquals(2, debouncer.cancelAll());
        assertEquals(0, debouncer.pendingCount());

        Thread.sleep(250);
        assertTrue(ran.isEmpty());
    }
}
