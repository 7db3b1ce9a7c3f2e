package com.example.filmarchive.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.filmarchive.domain.enumtype.AlertType;
import com.example.filmarchive.domain.enumtype.PipelineStage;
import com.example.filmarchive.domain.enumtype.ProcessingTrend;
import com.example.filmarchive.domain.model.PipelineAlert;
import com.example.filmarchive.domain.model.PipelineTelemetry;
import com.example.filmarchive.domain.model.QueueCounts;
import com.example.filmarchive.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineTelemetryServiceTest {

    private MutableClock clock;
    private PipelineStats stats;
    private PipelineTelemetryService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-02-10T12:00:00Z"));
        stats = new PipelineStats(clock);
        service = new PipelineTelemetryService();
    }

    @Test
    void reportShouldDeriveThroughputAndEta() {
        stats.recordSuccess(Duration.ofSeconds(20));
        stats.recordSuccess(Duration.ofSeconds(40));
        clock.advance(Duration.ofMinutes(90));

        PipelineTelemetry telemetry = service.report(stats, new QueueCounts(3, 1, 2), clock.instant());

        assertEquals(30.0D, telemetry.getAverageSeconds(), 1e-9);
        assertEquals(120.0D, telemetry.getPicturesPerHour(), 1e-9);
        assertEquals(120L, telemetry.getEtaSeconds());
        assertEquals(1.5D, telemetry.getSessionHours(), 1e-9);
        assertEquals(48, telemetry.getTimeline().size());
        assertEquals(2, telemetry.getProcessedCount());
    }

    @Test
    void reportShouldStayFiniteWithoutSamples() {
        PipelineTelemetry telemetry = service.report(stats, new QueueCounts(0, 0, 0), clock.instant());

        assertEquals(0.0D, telemetry.getAverageSeconds(), 1e-9);
        assertEquals(0.0D, telemetry.getPicturesPerHour(), 1e-9);
        assertEquals(0L, telemetry.getEtaSeconds());
        assertEquals(ProcessingTrend.STABLE, telemetry.getTrend());
        assertTrue(telemetry.getAlerts().isEmpty());
    }

    @Test
    void trendShouldNeedTenSamples() {
        List<Double> nine = new ArrayList<>(Arrays.asList(10D, 10D, 10D, 10D, 50D, 50D, 50D, 50D, 50D));
        assertEquals(ProcessingTrend.STABLE, PipelineTelemetryService.trend(nine));
    }

    @Test
    void trendShouldDetectSlowdownAndSpeedup() {
        List<Double> slower = Arrays.asList(10D, 10D, 10D, 10D, 10D, 20D, 20D, 20D, 20D, 20D);
        List<Double> faster = Arrays.asList(20D, 20D, 20D, 20D, 20D, 5D, 5D, 5D, 5D, 5D);
        List<Double> steady = Arrays.asList(10D, 11D, 10D, 9D, 10D, 10D, 11D, 10D, 9D, 10D);

        assertEquals(ProcessingTrend.DEGRADING, PipelineTelemetryService.trend(slower));
        assertEquals(ProcessingTrend.ACCELERATING, PipelineTelemetryService.trend(faster));
        assertEquals(ProcessingTrend.STABLE, PipelineTelemetryService.trend(steady));
    }

    @Test
    void shouldWarnWhenIdleWithPendingFiles() {
        List<PipelineAlert> alerts = PipelineTelemetryService.alerts(stats, stats.getCurrent(),
                new QueueCounts(2, 0, 0), ProcessingTrend.STABLE, clock.instant());

        assertEquals(1, alerts.size());
        assertEquals(AlertType.STALL_WARNING, alerts.get(0).getType());
        assertEquals("warning", alerts.get(0).getSeverity());
    }

    @Test
    void shouldNotWarnWhileProcessing() {
        stats.begin("scan.tif");

        List<PipelineAlert> alerts = PipelineTelemetryService.alerts(stats, stats.getCurrent(),
                new QueueCounts(2, 0, 0), ProcessingTrend.STABLE, clock.instant());

        assertTrue(alerts.isEmpty());
    }

    @Test
    void shouldRaiseErrorRateAlerts() {
        for (int i = 0; i < 8; i++) {
            stats.recordSuccess(Duration.ofSeconds(10));
        }
        stats.recordFailure("a.tif", "corrupt", PipelineStage.ENHANCING);
        stats.recordFailure("b.tif", "corrupt", PipelineStage.ENHANCING);

        List<PipelineAlert> alerts = PipelineTelemetryService.alerts(stats, stats.getCurrent(),
                new QueueCounts(0, 0, 8), ProcessingTrend.DEGRADING, clock.instant());

        List<AlertType> types = alerts.stream().map(PipelineAlert::getType).collect(Collectors.toList());
        assertEquals(Arrays.asList(AlertType.PERFORMANCE_DEGRADATION, AlertType.HIGH_ERROR_RATE), types);
        assertEquals("High error rate: 2 errors out of 10 files (20%)", alerts.get(1).getMessage());
    }

    @Test
    void shouldRaiseAllErrorsAlertWhenNothingSucceeded() {
        stats.recordFailure("a.tif", "corrupt", PipelineStage.INGESTING);

        List<PipelineAlert> alerts = PipelineTelemetryService.alerts(stats, stats.getCurrent(),
                new QueueCounts(0, 0, 0), ProcessingTrend.STABLE, clock.instant());

        List<AlertType> types = alerts.stream().map(PipelineAlert::getType).collect(Collectors.toList());
        assertEquals(Arrays.asList(AlertType.HIGH_ERROR_RATE, AlertType.ALL_ERRORS), types);
        assertEquals("error", alerts.get(1).getSeverity());
    }
}
