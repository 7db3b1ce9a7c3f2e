package com.example.filmarchive.application.service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs fire-and-forget work on the background pool so that failures are logged and counted
 * instead of disappearing with the thread.
 */
@Component
public class BackgroundTaskSupervisor {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskSupervisor.class);

    private final ExecutorService backgroundTaskExecutor;
    private final AtomicLong failures = new AtomicLong();

    public BackgroundTaskSupervisor(@Qualifier("backgroundTaskExecutor") ExecutorService backgroundTaskExecutor) {
        this.backgroundTaskExecutor = backgroundTaskExecutor;
    }

    /**
     * @return false when the pool refused the task; the refusal is counted as a failure
     */
    public boolean submit(String name, Runnable task) {
        try {
            backgroundTaskExecutor.execute(() -> run(name, task));
            return true;
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            log.warn("BACKGROUND_TASK_REJECTED task={} reason={}", name, e.getMessage());
            return false;
        }
    }

    public long getFailureCount() {
        return failures.get();
    }

    void run(String name, Runnable task) {
        long start = System.currentTimeMillis();
        try {
            task.run();
            log.debug("BACKGROUND_TASK_DONE task={} elapsedMs={}", name, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("BACKGROUND_TASK_FAILED task={} elapsedMs={}", name, System.currentTimeMillis() - start, e);
        }
    }
}
