package mu.fleet.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background jobs at a fixed delay:
 * - the hive's repeated gather + persist
 * - the viewers' snapshot polling
 *
 * Uses a single-threaded executor so jobs never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final List<Job> jobs = new ArrayList<>();

    private volatile boolean running = false;

    public Scheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a job; takes effect on {@link #start()}.
     *
     * @param name         used in log messages
     * @param initialDelay delay before the first run
     * @param delay        delay between the end of one run and the start of the next
     */
    public synchronized Scheduler every(String name, Duration initialDelay, Duration delay, Runnable task) {
        if (delay.isZero() || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be positive: " + delay);
        }
        jobs.add(new Job(name, initialDelay, delay, task));
        return this;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        for (Job job : jobs) {
            executor.scheduleWithFixedDelay(
                    wrapRunnable(job.name(), job.task()),
                    job.initialDelay().toMillis(),
                    job.delay().toMillis(),
                    TimeUnit.MILLISECONDS);
            log.info("{} scheduled every {}ms", job.name(), job.delay().toMillis());
        }

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling, so one failed run does not cancel the job.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }

    private record Job(String name, Duration initialDelay, Duration delay, Runnable task) {
    }
}
