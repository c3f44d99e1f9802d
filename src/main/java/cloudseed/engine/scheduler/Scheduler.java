package cloudseed.engine.scheduler;

import cloudseed.engine.repository.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs orchestrator ticks on a fixed delay.
 *
 * Uses a single-threaded executor so two ticks never overlap. A failing tick
 * is logged and the loop continues, except for a {@link TaskStoreException}:
 * the loop stops and {@link #run(Duration)} rethrows it.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskOrchestrator orchestrator;
    private final Duration stopTimeout;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean running = false;
    private volatile TaskStoreException storeFailure;

    public Scheduler(TaskOrchestrator orchestrator) {
        this(orchestrator, Duration.ofSeconds(30));
    }

    /**
     * @param orchestrator the tick to run
     * @param stopTimeout  how long {@link #stop()} waits for an in-flight tick
     */
    public Scheduler(TaskOrchestrator orchestrator, Duration stopTimeout) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cloudseed-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.orchestrator = orchestrator;
        this.stopTimeout = stopTimeout;
    }

    /**
     * Start ticking in the background: the first tick runs immediately, the next
     * one {@code interval} after the previous one finished.
     */
    public void start(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;
        executor.scheduleWithFixedDelay(this::tickSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Scheduler started, ticking every {}s", interval.toSeconds());
    }

    /**
     * Tick until {@link #stop()} is called from another thread or the task
     * store fails.
     *
     * @throws TaskStoreException   if the loop ended because of the store
     * @throws InterruptedException if the calling thread is interrupted
     */
    public void run(Duration interval) throws InterruptedException {
        start(interval);
        finished.await();
        if (storeFailure != null) {
            throw storeFailure;
        }
    }

    /**
     * Run a single tick on the calling thread.
     */
    public TickReport runOnce() {
        return orchestrator.tick();
    }

    /**
     * Stop the scheduler gracefully: an in-flight tick is allowed to finish.
     */
    public void stop() {
        if (!running) {
            finished.countDown();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            finished.countDown();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void tickSafely() {
        try {
            TickReport report = orchestrator.tick();
            if (report.changedAnything()) {
                log.info("Tick: {} examined, {} advanced, {} failed", report.examined(), report.advanced(),
                        report.failed());
            }
        } catch (TaskStoreException e) {
            log.error("Task store failure, stopping scheduler", e);
            storeFailure = e;
            running = false;
            executor.shutdown();
            finished.countDown();
        } catch (Exception e) {
            log.error("Tick error", e);
        }
    }
}
