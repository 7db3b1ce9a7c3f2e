package com.example.filmarchive.application.service;

import com.example.filmarchive.common.config.AppPipelineProperties;
import com.example.filmarchive.common.config.TaskExecutionConfig.NamedThreadFactory;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.common.exception.TransientIoException;
import com.example.filmarchive.common.util.ImageFileTypes;
import com.example.filmarchive.domain.enumtype.OutputFormat;
import com.example.filmarchive.domain.enumtype.PipelineStage;
import com.example.filmarchive.domain.model.EnhancementResult;
import com.example.filmarchive.domain.model.PipelineTelemetry;
import com.example.filmarchive.domain.model.QueueCounts;
import com.example.filmarchive.domain.model.StatusUpdate;
import com.example.filmarchive.domain.model.TagInfo;
import com.example.filmarchive.infrastructure.image.ImageTagger;
import com.example.filmarchive.infrastructure.persistence.ImageRepository;
import com.example.filmarchive.infrastructure.status.StatusSink;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Moves each stable scan through ingest, enhance, save and tag, one file at a time.
 * <p>
 * Watchers only enqueue; a single pipeline thread drains the queue in arrival order. Direct
 * callers of {@link #processFile(Path)} are serialised by the same lock. Heavy image work is
 * handed to the image worker pool and awaited, so the per-file state machine never overlaps.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String METRIC_RESULT = "film.pipeline.file.result";
    static final String METRIC_DURATION = "film.pipeline.file.duration";

    private final IngestNamingService ingestNamingService;
    private final ImageEnhancementService imageEnhancementService;
    private final ImageRepository imageRepository;
    private final ObjectProvider<ImageTagger> imageTaggerProvider;
    private final ObjectProvider<StatusSink> statusSinks;
    private final PipelineTelemetryService pipelineTelemetryService;
    private final BackgroundTaskSupervisor backgroundTaskSupervisor;
    private final AppPipelineProperties appPipelineProperties;
    private final ExecutorService imageTaskExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final PipelineStats stats;
    private final ExecutorService pipelineExecutor;
    private final ReentrantLock processingLock = new ReentrantLock();
    private final Set<Path> queued = ConcurrentHashMap.newKeySet();
    private volatile boolean stopping;

    public PipelineOrchestrator(IngestNamingService ingestNamingService,
                                ImageEnhancementService imageEnhancementService,
                                ImageRepository imageRepository,
                                ObjectProvider<ImageTagger> imageTaggerProvider,
                                ObjectProvider<StatusSink> statusSinks,
                                PipelineTelemetryService pipelineTelemetryService,
                                BackgroundTaskSupervisor backgroundTaskSupervisor,
                                AppPipelineProperties appPipelineProperties,
                                @Qualifier("imageTaskExecutor") ExecutorService imageTaskExecutor,
                                Clock clock,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.ingestNamingService = ingestNamingService;
        this.imageEnhancementService = imageEnhancementService;
        this.imageRepository = imageRepository;
        this.imageTaggerProvider = imageTaggerProvider;
        this.statusSinks = statusSinks;
        this.pipelineTelemetryService = pipelineTelemetryService;
        this.backgroundTaskSupervisor = backgroundTaskSupervisor;
        this.appPipelineProperties = appPipelineProperties;
        this.imageTaskExecutor = imageTaskExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        this.stats = new PipelineStats(clock);
        this.pipelineExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("pipeline-"));
    }

    public PipelineStats getStats() {
        return stats;
    }

    /**
     * Queues a newly stable scan. A path already waiting in the queue is not queued twice, and
     * nothing is queued once shutdown has begun.
     */
    public boolean submit(Path source) {
        return enqueue(source, () -> processFile(source));
    }

    public boolean submitArchived(Path archived) {
        return enqueue(archived, () -> processArchived(archived));
    }

    private boolean enqueue(Path path, Runnable work) {
        if (stopping) {
            log.debug("PIPELINE_STOPPING_SKIP file={}", path.getFileName());
            return false;
        }
        if (!queued.add(path)) {
            log.debug("PIPELINE_ALREADY_QUEUED file={}", path.getFileName());
            return false;
        }
        try {
            pipelineExecutor.execute(() -> {
                queued.remove(path);
                // left in place on disk; the next start picks it up again
                if (stopping) {
                    return;
                }
                work.run();
            });
            return true;
        } catch (RejectedExecutionException e) {
            queued.remove(path);
            log.warn("PIPELINE_QUEUE_REJECTED file={} reason={}", path.getFileName(), e.getMessage());
            return false;
        }
    }

    public void processFile(Path source) {
        processingLock.lock();
        try {
            execute(source, null);
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * Enhance and save an already archived raw; the archived path stands in for the original.
     */
    public void processArchived(Path archived) {
        processingLock.lock();
        try {
            execute(archived, archived);
        } finally {
            processingLock.unlock();
        }
    }

    public int recoverArchived() {
        Path outputDir = appPipelineProperties.outputDirectory();
        int count = 0;
        for (Path archived : DuplicateDetectionService.listImages(appPipelineProperties.archivedDirectory())) {
            if (!hasEnhancedOutput(archived, outputDir) && submitArchived(archived)) {
                count++;
            }
        }
        log.info("PIPELINE_RECOVERY_QUEUED count={}", count);
        return count;
    }

    public void handleOutputDeletion(Path deleted) {
        String filename = deleted.getFileName().toString();
        backgroundTaskSupervisor.submit("output-delete:" + filename, () -> imageRepository.delete(filename));
    }

    public QueueCounts queueCounts() {
        int input = 0;
        for (Path dir : appPipelineProperties.inputDirectories()) {
            input += DuplicateDetectionService.listImages(dir).size();
        }
        Path outputDir = appPipelineProperties.outputDirectory();
        int archived = 0;
        for (Path raw : DuplicateDetectionService.listImages(appPipelineProperties.archivedDirectory())) {
            if (!hasEnhancedOutput(raw, outputDir)) {
                archived++;
            }
        }
        int completed = 0;
        for (Path out : DuplicateDetectionService.listImages(outputDir)) {
            if (out.getFileName().toString().endsWith(OutputFormat.JPEG.getSuffix())) {
                completed++;
            }
        }
        return new QueueCounts(input, archived, completed);
    }

    public PipelineTelemetry telemetry() {
        PipelineTelemetry telemetry = pipelineTelemetryService.report(stats, queueCounts(), clock.instant());
        telemetry.setBackgroundFailures(backgroundTaskSupervisor.getFailureCount());
        return telemetry;
    }

    boolean isStopping() {
        return stopping;
    }

    /**
     * Lets the in-flight file finish. Queued files are skipped and stay in their directories.
     */
    @PreDestroy
    public void shutdown() {
        stopping = true;
        int skipped = queued.size();
        queued.clear();
        pipelineExecutor.shutdown();
        try {
            if (!pipelineExecutor.awaitTermination(appPipelineProperties.getShutdownTimeoutSec(), TimeUnit.SECONDS)) {
                log.warn("PIPELINE_SHUTDOWN_TIMEOUT file={}", stats.getCurrent().getFile());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (skipped > 0) {
            log.info("PIPELINE_QUEUE_LEFT_FOR_NEXT_START count={}", skipped);
        }
        log.info("PIPELINE_STOPPED processed={} errors={}", stats.getProcessedCount(), stats.getErrorCount());
    }

    private void execute(Path original, Path archived) {
        long startNanos = System.nanoTime();
        String originalName = original.getFileName().toString();
        String display = originalName;
        PipelineStage stage = PipelineStage.QUEUED;
        stats.begin(display);
        EnhancementResult result = null;
        try {
            Path raw = archived;
            if (raw == null) {
                stage = advance(display, PipelineStage.INGESTING);
                try {
                    raw = ingestNamingService.ingest(original);
                } catch (TransientIoException e) {
                    if (!Files.exists(original)) {
                        log.info("PIPELINE_SOURCE_VANISHED file={} reason={}", display, e.getMessage());
                        return;
                    }
                    throw e;
                }
                display = raw.getFileName().toString();
            }

            stage = advance(display, PipelineStage.ENHANCING);
            final Path enhanceSource = raw;
            result = awaitWork(() -> imageEnhancementService.enhance(enhanceSource));

            stage = advance(display, PipelineStage.SAVING);
            final EnhancementResult enhanced = result;
            String stem = ImageFileTypes.stem(raw.getFileName().toString());
            Map<OutputFormat, Path> saved = awaitWork(() ->
                    imageEnhancementService.save(enhanced, appPipelineProperties.outputDirectory(), stem));
            Path jpeg = saved.get(OutputFormat.JPEG);
            try {
                imageRepository.upsert(original, raw, jpeg, result);
            } catch (RuntimeException e) {
                removeOutputs(saved);
                throw e;
            }

            stage = advance(display, PipelineStage.TAGGING);
            tag(jpeg);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            stats.recordSuccess(elapsed);
            advance(display, PipelineStage.COMPLETE);
            incrementCounter(METRIC_RESULT, "outcome", "success");
            recordDuration(elapsed);
            log.info("PIPELINE_FILE_DONE file={} output={} preset={} score={} faces={} durationMs={}",
                    display, jpeg.getFileName(),
                    result.getParams().getPreset() == null ? "configured" : result.getParams().getPreset().getValue(),
                    String.format("%.1f", result.getQualityScore()), result.isFacesDetected(), elapsed.toMillis());
        } catch (RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            stats.recordFailure(originalName, message, stage);
            stats.advance(display, PipelineStage.ERROR);
            publish(new StatusUpdate(PipelineStage.ERROR, PipelineStage.ERROR.getProgress(), display, message));
            incrementCounter(METRIC_RESULT, "outcome", "error");
            log.error("PIPELINE_FILE_FAILED file={} archived={} stage={} code={}",
                    originalName, display, stage.getValue(), codeOf(e), e);
        } finally {
            if (result != null && result.getEnhanced() != null) {
                result.getEnhanced().release();
            }
            stats.finish();
        }
    }

    private void tag(Path jpeg) {
        ImageTagger tagger = imageTaggerProvider.getIfAvailable();
        if (tagger == null || !tagger.isAvailable()) {
            return;
        }
        String filename = jpeg.getFileName().toString();
        try {
            if (imageRepository.hasAiTags(filename)) {
                log.debug("PIPELINE_TAGS_PRESENT file={}", filename);
                return;
            }
            List<TagInfo> tags = awaitWork(() -> tagger.generateTags(jpeg));
            imageRepository.saveAiTags(filename, tags);
        } catch (RuntimeException e) {
            log.warn("PIPELINE_TAGGING_FAILED file={} reason={}", filename, e.getMessage());
        }
    }

    private PipelineStage advance(String file, PipelineStage stage) {
        stats.advance(file, stage);
        publish(new StatusUpdate(stage, stage.getProgress(), file, null));
        return stage;
    }

    private void publish(StatusUpdate update) {
        statusSinks.orderedStream().forEach(sink -> {
            try {
                sink.publish(update);
            } catch (RuntimeException e) {
                log.warn("PIPELINE_STATUS_DELIVERY_FAILED sink={} reason={}",
                        sink.getClass().getSimpleName(), e.getMessage());
            }
        });
    }

    private <T> T awaitWork(Callable<T> work) {
        if (imageTaskExecutor.isShutdown()) {
            throw new PipelineException("IMAGE_POOL_CLOSED", "Image worker pool is shut down");
        }
        Future<T> future;
        try {
            future = imageTaskExecutor.submit(work);
        } catch (RejectedExecutionException e) {
            throw new PipelineException("IMAGE_POOL_CLOSED", "Image worker pool rejected the task", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineException("PIPELINE_INTERRUPTED", "Interrupted while waiting for image work", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new PipelineException("IMAGE_WORK_FAILED", String.valueOf(cause), cause);
        }
    }

    // recovery keys on the JPEG, so it must not outlive a failed upsert
    private static void removeOutputs(Map<OutputFormat, Path> saved) {
        for (Path output : saved.values()) {
            try {
                Files.deleteIfExists(output);
            } catch (IOException e) {
                log.warn("PIPELINE_OUTPUT_CLEANUP_FAILED file={} reason={}", output.getFileName(), e.getMessage());
            }
        }
    }

    private static boolean hasEnhancedOutput(Path raw, Path outputDir) {
        String stem = ImageFileTypes.stem(raw.getFileName().toString());
        return Files.exists(outputDir.resolve(OutputFormat.JPEG.fileName(stem)));
    }

    private static String codeOf(RuntimeException e) {
        return e instanceof PipelineException ? ((PipelineException) e).getCode() : "UNEXPECTED";
    }

    private void incrementCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(Duration elapsed) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.timer(METRIC_DURATION).record(elapsed.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", METRIC_DURATION, e);
        }
    }
}
