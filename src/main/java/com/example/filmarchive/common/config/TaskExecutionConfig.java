package com.example.filmarchive.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService imageTaskExecutor;
    private ScheduledExecutorService watcherScheduler;
    private ExecutorService backgroundTaskExecutor;

    /**
     * Bounded pool for CPU-heavy image work. Callers block on the returned futures,
     * so a full queue pushes the work back onto the caller instead of failing it.
     * Once the pool is shut down submissions are rejected.
     */
    @Bean
    public ExecutorService imageTaskExecutor(AppPipelineProperties appPipelineProperties) {
        int core = Math.max(1, Math.min(8, appPipelineProperties.getWorkerThreads()));
        this.imageTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(16, appPipelineProperties.getWorkerQueueSize())),
                new NamedThreadFactory("image-worker-"),
                callerRunsUntilShutdown());
        return this.imageTaskExecutor;
    }

    /**
     * Like {@link ThreadPoolExecutor.CallerRunsPolicy}, but throws instead of silently
     * dropping the task after shutdown, so a caller waiting on the future is released.
     */
    public static RejectedExecutionHandler callerRunsUntilShutdown() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Image worker pool is shut down");
            }
            task.run();
        };
    }

    @Bean
    public ScheduledExecutorService watcherScheduler() {
        this.watcherScheduler = Executors.newScheduledThreadPool(1, new NamedThreadFactory("watcher-poll-"));
        return this.watcherScheduler;
    }

    @Bean
    public ExecutorService backgroundTaskExecutor() {
        this.backgroundTaskExecutor = new ThreadPoolExecutor(
                1,
                2,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                new NamedThreadFactory("background-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.backgroundTaskExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (watcherScheduler != null) {
            watcherScheduler.shutdownNow();
        }
        if (backgroundTaskExecutor != null) {
            backgroundTaskExecutor.shutdown();
        }
        if (imageTaskExecutor != null) {
            imageTaskExecutor.shutdown();
        }
    }

    public static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
