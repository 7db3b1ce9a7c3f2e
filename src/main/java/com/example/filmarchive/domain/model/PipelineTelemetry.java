package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.ProcessingTrend;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class PipelineTelemetry {

    private CurrentOperation current;

    private QueueCounts queue;

    private long processedCount;

    private long errorCount;

    private double averageSeconds;

    private double picturesPerHour;

    private long etaSeconds;

    private Instant sessionStartedAt;

    private double sessionHours;

    private ProcessingTrend trend;

    private List<PipelineAlert> alerts = new ArrayList<>();

    private List<HourlyCount> timeline = new ArrayList<>();

    private List<ErrorRecord> recentErrors = new ArrayList<>();

    private long backgroundFailures;
}
