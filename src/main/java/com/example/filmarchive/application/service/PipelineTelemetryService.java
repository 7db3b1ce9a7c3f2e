package com.example.filmarchive.application.service;

import com.example.filmarchive.domain.enumtype.AlertType;
import com.example.filmarchive.domain.enumtype.ProcessingTrend;
import com.example.filmarchive.domain.model.CurrentOperation;
import com.example.filmarchive.domain.model.PipelineAlert;
import com.example.filmarchive.domain.model.PipelineTelemetry;
import com.example.filmarchive.domain.model.QueueCounts;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Derives throughput, ETA, trend and alerts from a stats snapshot. Nothing here is stored;
 * every report is computed fresh.
 */
@Service
public class PipelineTelemetryService {

    static final int TREND_MIN_SAMPLES = 10;
    static final int TREND_RECENT_SAMPLES = 5;
    static final double DEGRADING_FACTOR = 1.3D;
    static final double ACCELERATING_FACTOR = 0.7D;
    static final double HIGH_ERROR_RATE = 0.1D;

    public PipelineTelemetry report(PipelineStats stats, QueueCounts queue, Instant now) {
        List<Double> durations = stats.recentDurations();
        double average = mean(durations);
        ProcessingTrend trend = trend(durations);
        CurrentOperation current = stats.getCurrent();

        PipelineTelemetry telemetry = new PipelineTelemetry();
        telemetry.setCurrent(current);
        telemetry.setQueue(queue);
        telemetry.setProcessedCount(stats.getProcessedCount());
        telemetry.setErrorCount(stats.getErrorCount());
        telemetry.setAverageSeconds(average);
        telemetry.setPicturesPerHour(average > 0 ? 3600.0D / average : 0.0D);
        telemetry.setEtaSeconds(queue.pending() > 0 && average > 0 ? Math.round(queue.pending() * average) : 0L);
        telemetry.setSessionStartedAt(stats.getSessionStart());
        telemetry.setSessionHours(Duration.between(stats.getSessionStart(), now).toMillis() / 3_600_000.0D);
        telemetry.setTrend(trend);
        telemetry.setAlerts(alerts(stats, current, queue, trend, now));
        telemetry.setTimeline(stats.timeline(now));
        telemetry.setRecentErrors(stats.recentErrors());
        return telemetry;
    }

    /**
     * Compares the last five samples with the whole window. Needs at least ten samples.
     */
    static ProcessingTrend trend(List<Double> durations) {
        if (durations.size() < TREND_MIN_SAMPLES) {
            return ProcessingTrend.STABLE;
        }
        double overall = mean(durations);
        double recent = mean(durations.subList(durations.size() - TREND_RECENT_SAMPLES, durations.size()));
        if (recent > overall * DEGRADING_FACTOR) {
            return ProcessingTrend.DEGRADING;
        }
        if (recent < overall * ACCELERATING_FACTOR) {
            return ProcessingTrend.ACCELERATING;
        }
        return ProcessingTrend.STABLE;
    }

    static List<PipelineAlert> alerts(PipelineStats stats, CurrentOperation current, QueueCounts queue,
                                      ProcessingTrend trend, Instant now) {
        List<PipelineAlert> alerts = new ArrayList<>();
        if (!current.isProcessing() && queue.pending() > 0) {
            alerts.add(PipelineAlert.of(AlertType.STALL_WARNING,
                    "Pipeline idle with " + queue.pending() + " pending files", now));
        }
        if (trend == ProcessingTrend.DEGRADING) {
            alerts.add(PipelineAlert.of(AlertType.PERFORMANCE_DEGRADATION, "Processing speed has slowed down", now));
        }
        long errors = stats.getErrorCount();
        long processed = stats.getProcessedCount();
        if (errors > 0) {
            long attempts = processed + errors;
            double rate = (double) errors / attempts;
            if (rate > HIGH_ERROR_RATE) {
                alerts.add(PipelineAlert.of(AlertType.HIGH_ERROR_RATE, String.format(
                        "High error rate: %d errors out of %d files (%d%%)", errors, attempts, (int) (rate * 100)), now));
            }
            if (processed == 0) {
                alerts.add(PipelineAlert.of(AlertType.ALL_ERRORS,
                        errors + " file(s) failed with errors. Check the error log.", now));
            }
        }
        return alerts;
    }

    private static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0D;
        }
        double sum = 0.0D;
        for (Double value : values) {
            sum += value;
        }
        return sum / values.size();
    }
}
