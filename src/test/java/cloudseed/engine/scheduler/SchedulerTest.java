package cloudseed.engine.scheduler;

import cloudseed.engine.repository.TaskStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerTest {

    @Mock
    private TaskOrchestrator orchestrator;

    @Test
    void runOnceTicksOnCallingThread() {
        TickReport report = new TickReport(2, 1, 0, 0);
        when(orchestrator.tick()).thenReturn(report);

        try (Scheduler scheduler = new Scheduler(orchestrator)) {
            assertEquals(report, scheduler.runOnce());
            assertFalse(scheduler.isRunning());
        }
        verify(orchestrator, times(1)).tick();
    }

    @Test
    void ticksRepeatedlyUntilStopped() throws Exception {
        CountDownLatch threeTicks = new CountDownLatch(3);
        when(orchestrator.tick()).thenAnswer(inv -> {
            threeTicks.countDown();
            return TickReport.empty();
        });

        Scheduler scheduler = new Scheduler(orchestrator, Duration.ofSeconds(5));
        scheduler.start(Duration.ofMillis(10));
        assertTrue(scheduler.isRunning());

        assertTrue(threeTicks.await(5, TimeUnit.SECONDS));
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void tickErrorsDoNotStopTheLoop() throws Exception {
        CountDownLatch secondTick = new CountDownLatch(2);
        when(orchestrator.tick()).thenAnswer(inv -> {
            secondTick.countDown();
            if (secondTick.getCount() == 1) {
                throw new IllegalStateException("boom");
            }
            return TickReport.empty();
        });

        try (Scheduler scheduler = new Scheduler(orchestrator)) {
            scheduler.start(Duration.ofMillis(10));
            assertTrue(secondTick.await(5, TimeUnit.SECONDS));
            assertTrue(scheduler.isRunning());
        }
    }

    @Test
    void storeFailureEndsRunAndIsRethrown() {
        when(orchestrator.tick()).thenThrow(new TaskStoreException("disk full"));

        Scheduler scheduler = new Scheduler(orchestrator);

        TaskStoreException e = assertThrows(TaskStoreException.class, () -> scheduler.run(Duration.ofMillis(10)));
        assertEquals("disk full", e.getMessage());
        assertFalse(scheduler.isRunning());
        verify(orchestrator, times(1)).tick();
    }

    @Test
    void stopFromAnotherThreadReleasesRun() throws Exception {
        when(orchestrator.tick()).thenReturn(TickReport.empty());
        Scheduler scheduler = new Scheduler(orchestrator);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread runner = new Thread(() -> {
            try {
                scheduler.run(Duration.ofMillis(20));
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        runner.start();

        verify(orchestrator, timeout(5000).atLeastOnce()).tick();
        scheduler.stop();
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertNull(failure.get());
    }

    @Test
    void rejectsNonPositiveInterval() {
        try (Scheduler scheduler = new Scheduler(orchestrator)) {
            assertThrows(IllegalArgumentException.class, () -> scheduler.start(Duration.ZERO));
        }
    }
}
