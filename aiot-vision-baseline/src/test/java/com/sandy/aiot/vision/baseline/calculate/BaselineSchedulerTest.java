package com.sandy.aiot.vision.baseline.calculate;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineSchedulerTest {

    @Mock
    BaselineCalculator calculator;

    @Test
    void overlappingRunIsSkipped() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RunSummary done = new RunSummary(RunSummary.State.DONE, List.of("service_cpm"), List.of());
        when(calculator.start()).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return done;
        });
        BaselineScheduler scheduler = new BaselineScheduler(calculator);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RunSummary> first = executor.submit(scheduler::runOnce);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertEquals(RunSummary.State.SKIPPED, scheduler.runOnce().state());

            release.countDown();
            assertEquals(done, first.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        verify(calculator, times(1)).start();
    }

    @Test
    void nextRunStartsAfterPreviousFinished() {
        when(calculator.start()).thenReturn(RunSummary.aborted());
        BaselineScheduler scheduler = new BaselineScheduler(calculator);

        scheduler.runOnce();
        scheduler.runOnce();

        verify(calculator, times(2)).start();
    }

    @Test
    void failingRunReleasesTheLock() {
        when(calculator.start()).thenThrow(new IllegalStateException("boom")).thenReturn(RunSummary.aborted());
        BaselineScheduler scheduler = new BaselineScheduler(calculator);

        assertThrows(IllegalStateException.class, scheduler::runOnce);
        assertEquals(RunSummary.State.ABORTED, scheduler.runOnce().state());
    }
}
