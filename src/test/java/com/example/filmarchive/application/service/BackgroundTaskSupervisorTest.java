package com.example.filmarchive.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class BackgroundTaskSupervisorTest {

    @Test
    void failingTaskShouldBeCountedAndContained() throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        BackgroundTaskSupervisor supervisor = new BackgroundTaskSupervisor(executor);
        AtomicBoolean laterRan = new AtomicBoolean();

        supervisor.submit("explode", () -> {
            throw new IllegalStateException("boom");
        });
        supervisor.submit("after", () -> laterRan.set(true));
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1L, supervisor.getFailureCount());
        assertTrue(laterRan.get());
    }

    @Test
    void rejectedTaskShouldCountAsFailure() {
        ExecutorService executor = mock(ExecutorService.class);
        doThrow(new RejectedExecutionException("queue full")).when(executor).execute(any(Runnable.class));
        BackgroundTaskSupervisor supervisor = new BackgroundTaskSupervisor(executor);

        assertFalse(supervisor.submit("resume", () -> { }));
        assertEquals(1L, supervisor.getFailureCount());
    }
}
