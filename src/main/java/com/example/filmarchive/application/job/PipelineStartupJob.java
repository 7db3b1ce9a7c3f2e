package com.example.filmarchive.application.job;

import com.example.filmarchive.application.service.BackgroundTaskSupervisor;
import com.example.filmarchive.application.service.PipelineOrchestrator;
import com.example.filmarchive.common.config.AppPipelineProperties;
import com.example.filmarchive.common.exception.TransientIoException;
import com.example.filmarchive.infrastructure.watcher.StabilityWatcher;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Starts one watcher per input directory plus one on the output directory, then resumes
 * whatever an interrupted run left behind. Watchers whose directory cannot be prepared are
 * retried on a fixed delay.
 */
@Service
public class PipelineStartupJob {

    private static final Logger log = LoggerFactory.getLogger(PipelineStartupJob.class);

    private final AppPipelineProperties appPipelineProperties;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final BackgroundTaskSupervisor backgroundTaskSupervisor;
    private final ScheduledExecutorService watcherScheduler;
    private final Clock clock;

    private final List<StabilityWatcher> inputWatchers = new CopyOnWriteArrayList<>();
    private final List<StabilityWatcher> allWatchers = new CopyOnWriteArrayList<>();
    private final List<StabilityWatcher> waitingToStart = new CopyOnWriteArrayList<>();
    private volatile boolean started;

    public PipelineStartupJob(AppPipelineProperties appPipelineProperties,
                              PipelineOrchestrator pipelineOrchestrator,
                              BackgroundTaskSupervisor backgroundTaskSupervisor,
                              @Qualifier("watcherScheduler") ScheduledExecutorService watcherScheduler,
                              Clock clock) {
        this.appPipelineProperties = appPipelineProperties;
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.backgroundTaskSupervisor = backgroundTaskSupervisor;
        this.watcherScheduler = watcherScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!appPipelineProperties.isEnabled()) {
            log.info("PIPELINE_DISABLED");
            return;
        }
        start();
    }

    synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        Duration poll = Duration.ofMillis(appPipelineProperties.getPollIntervalMs());
        for (Path dir : appPipelineProperties.inputDirectories()) {
            StabilityWatcher watcher = new StabilityWatcher(dir, pipelineOrchestrator::submit, null,
                    seconds(appPipelineProperties.getDebounceSeconds()), poll, watcherScheduler, clock);
            inputWatchers.add(watcher);
            allWatchers.add(watcher);
        }
        StabilityWatcher outputWatcher = new StabilityWatcher(appPipelineProperties.outputDirectory(),
                path -> log.debug("OUTPUT_FILE_SETTLED file={}", path.getFileName()),
                pipelineOrchestrator::handleOutputDeletion,
                seconds(appPipelineProperties.getOutputDebounceSeconds()), poll, watcherScheduler, clock);
        allWatchers.add(outputWatcher);

        for (StabilityWatcher watcher : allWatchers) {
            tryStart(watcher);
        }
        log.info("PIPELINE_STARTED inputDirs={} archivedDir={} outputDir={} waitingWatchers={}",
                appPipelineProperties.inputDirectories(), appPipelineProperties.archivedDirectory(),
                appPipelineProperties.outputDirectory(), waitingToStart.size());

        backgroundTaskSupervisor.submit("startup-resume", this::resume);
    }

    /**
     * Queues scans already sitting in the input directories and archived raws never enhanced.
     */
    void resume() {
        int existing = 0;
        for (StabilityWatcher watcher : inputWatchers) {
            if (watcher.isRunning()) {
                existing += watcher.scanExisting();
            }
        }
        int recovered = pipelineOrchestrator.recoverArchived();
        log.info("PIPELINE_RESUME_DONE existing={} recovered={}", existing, recovered);
    }

    @Scheduled(fixedDelayString = "${app.pipeline.watcher-retry-interval-ms:30000}",
            initialDelayString = "${app.pipeline.watcher-retry-interval-ms:30000}")
    public void retryWatchers() {
        if (waitingToStart.isEmpty()) {
            return;
        }
        List<StabilityWatcher> snapshot = new ArrayList<>(waitingToStart);
        for (StabilityWatcher watcher : snapshot) {
            waitingToStart.remove(watcher);
            if (tryStart(watcher) && inputWatchers.contains(watcher)) {
                backgroundTaskSupervisor.submit("watcher-resume:" + watcher.getWatchDir(), watcher::scanExisting);
            }
        }
    }

    List<StabilityWatcher> getWaitingWatchers() {
        return new ArrayList<>(waitingToStart);
    }

    List<StabilityWatcher> getWatchers() {
        return new ArrayList<>(allWatchers);
    }

    @PreDestroy
    public void stop() {
        for (StabilityWatcher watcher : allWatchers) {
            watcher.stop();
        }
        log.info("PIPELINE_WATCHERS_STOPPED count={}", allWatchers.size());
    }

    private boolean tryStart(StabilityWatcher watcher) {
        try {
            watcher.start();
            return true;
        } catch (TransientIoException e) {
            waitingToStart.add(watcher);
            log.warn("WATCHER_START_DEFERRED dir={} reason={}", watcher.getWatchDir(), e.getMessage());
            return false;
        }
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000D));
    }
}
