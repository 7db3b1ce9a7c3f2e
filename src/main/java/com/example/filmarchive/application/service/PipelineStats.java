package com.example.filmarchive.application.service;

import com.example.filmarchive.domain.enumtype.PipelineStage;
import com.example.filmarchive.domain.model.CurrentOperation;
import com.example.filmarchive.domain.model.ErrorRecord;
import com.example.filmarchive.domain.model.HourlyCount;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Runtime statistics of one orchestrator. Written only from the processing path; every read
 * is lock-free and may observe a file's updates partially applied.
 */
public class PipelineStats {

    public static final int DURATION_WINDOW = 50;
    public static final int ERROR_LOG_SIZE = 50;
    public static final int TIMELINE_HOURS = 48;

    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter HOUR_LABEL = DateTimeFormatter.ofPattern("HH:00")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Instant sessionStart;
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final ConcurrentLinkedDeque<Double> durations = new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<ErrorRecord> errors = new ConcurrentLinkedDeque<>();
    // slot = epochHour % TIMELINE_HOURS; a slot whose key is stale counts as zero
    private final AtomicLongArray hourKeys = new AtomicLongArray(TIMELINE_HOURS);
    private final AtomicIntegerArray hourCounts = new AtomicIntegerArray(TIMELINE_HOURS);
    private volatile CurrentOperation current = CurrentOperation.idle();

    public PipelineStats(Clock clock) {
        this.clock = clock;
        this.sessionStart = clock.instant();
        for (int i = 0; i < TIMELINE_HOURS; i++) {
            hourKeys.set(i, -1L);
        }
    }

    public void begin(String file) {
        current = new CurrentOperation(true, file, PipelineStage.QUEUED, PipelineStage.QUEUED.getProgress());
    }

    public void advance(String file, PipelineStage stage) {
        current = new CurrentOperation(!stage.isTerminal(), file, stage, stage.getProgress());
    }

    public void finish() {
        current = CurrentOperation.idle();
    }

    public void recordSuccess(Duration elapsed) {
        processedCount.incrementAndGet();
        durations.addLast(elapsed.toMillis() / 1000.0D);
        while (durations.size() > DURATION_WINDOW) {
            durations.pollFirst();
        }
        long hour = TimeUnit.MILLISECONDS.toHours(clock.millis());
        int slot = (int) (hour % TIMELINE_HOURS);
        if (hourKeys.get(slot) != hour) {
            hourCounts.set(slot, 0);
            hourKeys.set(slot, hour);
        }
        hourCounts.incrementAndGet(slot);
    }

    public void recordFailure(String file, String message, PipelineStage stage) {
        errorCount.incrementAndGet();
        errors.addLast(new ErrorRecord(file, message, clock.instant(), stage));
        while (errors.size() > ERROR_LOG_SIZE) {
            errors.pollFirst();
        }
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public Instant getSessionStart() {
        return sessionStart;
    }

    public CurrentOperation getCurrent() {
        return current;
    }

    public List<Double> recentDurations() {
        return new ArrayList<>(durations);
    }

    public List<ErrorRecord> recentErrors() {
        return new ArrayList<>(errors);
    }

    /**
     * Completions per UTC hour for the trailing 48 hours ending with the hour of {@code now},
     * oldest first.
     */
    public List<HourlyCount> timeline(Instant now) {
        long nowHour = TimeUnit.MILLISECONDS.toHours(now.toEpochMilli());
        List<HourlyCount> result = new ArrayList<>(TIMELINE_HOURS);
        for (long hour = nowHour - TIMELINE_HOURS + 1; hour <= nowHour; hour++) {
            int slot = (int) (hour % TIMELINE_HOURS);
            int count = hourKeys.get(slot) == hour ? hourCounts.get(slot) : 0;
            Instant at = Instant.ofEpochMilli(TimeUnit.HOURS.toMillis(hour));
            result.add(new HourlyCount(HOUR_LABEL.format(at), HOUR_KEY.format(at), count));
        }
        return result;
    }
}
