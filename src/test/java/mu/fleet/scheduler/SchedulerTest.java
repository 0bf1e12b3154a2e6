package mu.fleet.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    @Test
    void failingRunDoesNotCancelJob() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);

        try (Scheduler scheduler = new Scheduler("test-scheduler")) {
            scheduler.every("flaky", Duration.ZERO, Duration.ofMillis(10), () -> {
                runs.incrementAndGet();
                threeRuns.countDown();
                throw new IllegalStateException("boom");
            });
            scheduler.start();

            assertTrue(threeRuns.await(5, TimeUnit.SECONDS));
            assertTrue(scheduler.isRunning());
        }
        assertTrue(runs.get() >= 3);
    }

    @Test
    void stopIsIdempotent() {
        Scheduler scheduler = new Scheduler("test-scheduler");
        scheduler.start();
        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void rejectsNonPositiveDelay() {
        Scheduler scheduler = new Scheduler("test-scheduler");
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.every("bad", Duration.ZERO, Duration.ZERO, () -> { }));
    }
}
