package com.example.filmarchive.application.job;

import com.example.filmarchive.application.service.DuplicateDetectionService;
import com.example.filmarchive.application.service.PipelineOrchestrator;
import com.example.filmarchive.domain.model.DuplicateScanStatus;
import com.example.filmarchive.domain.model.PipelineAlert;
import com.example.filmarchive.domain.model.PipelineTelemetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class TelemetryReportJob {

    private static final Logger log = LoggerFactory.getLogger(TelemetryReportJob.class);

    private final PipelineOrchestrator pipelineOrchestrator;
    private final DuplicateDetectionService duplicateDetectionService;
    private final ObjectMapper objectMapper;

    public TelemetryReportJob(PipelineOrchestrator pipelineOrchestrator,
                              DuplicateDetectionService duplicateDetectionService,
                              ObjectMapper objectMapper) {
        this.pipelineOrchestrator = pipelineOrchestrator;
        this.duplicateDetectionService = duplicateDetectionService;
        this.objectMapper = objectMapper;
    }

    @Scheduled(fixedDelayString = "${app.pipeline.telemetry-interval-ms:60000}",
            initialDelayString = "${app.pipeline.telemetry-interval-ms:60000}")
    public void run() {
        PipelineTelemetry telemetry = pipelineOrchestrator.telemetry();
        for (PipelineAlert alert : telemetry.getAlerts()) {
            if ("error".equals(alert.getSeverity())) {
                log.error("PIPELINE_ALERT type={} message={}", alert.getType(), alert.getMessage());
            } else if ("warning".equals(alert.getSeverity())) {
                log.warn("PIPELINE_ALERT type={} message={}", alert.getType(), alert.getMessage());
            } else {
                log.info("PIPELINE_ALERT type={} message={}", alert.getType(), alert.getMessage());
            }
        }
        try {
            log.info("PIPELINE_STATUS {}", objectMapper.writeValueAsString(telemetry));
        } catch (JsonProcessingException e) {
            log.warn("PIPELINE_STATUS processed={} errors={} pending={} serializeError={}",
                    telemetry.getProcessedCount(), telemetry.getErrorCount(),
                    telemetry.getQueue() == null ? 0 : telemetry.getQueue().pending(), e.getMessage());
        }
        DuplicateScanStatus scan = duplicateDetectionService.getScanStatus();
        if (scan.isRunning()) {
            log.info("DUPLICATE_SCAN_PROGRESS phase={} current={} total={} startedAt={}",
                    scan.getPhase(), scan.getCurrent(), scan.getTotal(), scan.getStartedAt());
        }
    }
}
