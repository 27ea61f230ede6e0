package org.covidwatch;

import org.covidwatch.util.SimpleWakeSignal;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimpleWakeSignalTest {

    @Test
    void wakeFromAnotherThreadEndsTheWait() throws Exception {
        SimpleWakeSignal s = new SimpleWakeSignal();

        Thread t = new Thread(() -> {
            try { Thread.sleep(25); } catch (InterruptedException ignored) {}
            s.wake();
        });
        t.start();

        assertTrue(s.awaitWake(Duration.ofSeconds(5)));
        assertFalse(s.isPending(), "the wake-up is consumed");
    }

    @Test
    void awaitTimesOut() throws Exception {
        SimpleWakeSignal s = new SimpleWakeSignal();
        long start = System.nanoTime();
        assertFalse(s.awaitWake(Duration.ofMillis(20)));
        assertTrue(System.nanoTime() - start >= 20_000_000L);
    }

    @Test
    void wakeBeforeWaitIsKeptAndCollapsed() throws Exception {
        SimpleWakeSignal s = new SimpleWakeSignal();
        s.wake();
        s.wake();
        assertTrue(s.isPending());
        assertTrue(s.awaitWake(Duration.ofSeconds(5)));
        assertFalse(s.awaitWake(Duration.ofMillis(10)), "two requests count as one");
    }
}
