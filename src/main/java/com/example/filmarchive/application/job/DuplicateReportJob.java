package com.example.filmarchive.application.job;

import com.example.filmarchive.application.service.DuplicateDetectionService;
import com.example.filmarchive.common.config.AppDuplicateProperties;
import com.example.filmarchive.common.config.AppPipelineProperties;
import com.example.filmarchive.common.exception.PipelineException;
import com.example.filmarchive.domain.model.DuplicateGroup;
import com.example.filmarchive.domain.model.InboundDuplicateRecord;
import com.example.filmarchive.domain.model.InboundDuplicateReport;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic duplicate report: inbound scans against the archive, then groups within the output
 * directory. Disabled unless {@code app.duplicate.report-cron} is set.
 */
@Service
public class DuplicateReportJob {

    private static final Logger log = LoggerFactory.getLogger(DuplicateReportJob.class);

    private final DuplicateDetectionService duplicateDetectionService;
    private final AppPipelineProperties appPipelineProperties;
    private final AppDuplicateProperties appDuplicateProperties;

    public DuplicateReportJob(DuplicateDetectionService duplicateDetectionService,
                              AppPipelineProperties appPipelineProperties,
                              AppDuplicateProperties appDuplicateProperties) {
        this.duplicateDetectionService = duplicateDetectionService;
        this.appPipelineProperties = appPipelineProperties;
        this.appDuplicateProperties = appDuplicateProperties;
    }

    @Scheduled(cron = "${app.duplicate.report-cron:-}")
    public void run() {
        log.info("DUPLICATE_REPORT_TRIGGERED cron={} threshold={}",
                appDuplicateProperties.getReportCron(), appDuplicateProperties.getThreshold());
        try {
            for (Path inputDir : appPipelineProperties.inputDirectories()) {
                InboundDuplicateReport report = duplicateDetectionService.scanInbound(
                        inputDir, appPipelineProperties.archivedDirectory());
                for (InboundDuplicateRecord record : report.getRecords()) {
                    log.info("DUPLICATE_INBOUND type={} input={} match={} similarity={} action={}",
                            record.getType().getValue(), record.getInputFile(), record.getMatch(),
                            String.format("%.3f", record.getSimilarity()), record.getAction().getValue());
                }
                log.info("DUPLICATE_INBOUND_SUMMARY dir={} total={} skip={} alert={}",
                        inputDir, report.getTotalInput(), report.getSkipCount(), report.getAlertCount());
            }
            List<DuplicateGroup> groups = duplicateDetectionService.findDuplicates(
                    appPipelineProperties.outputDirectory());
            for (DuplicateGroup group : groups) {
                log.info("DUPLICATE_GROUP seed={} count={} meanSimilarity={} type={}",
                        group.getSeed(), group.getCount(),
                        String.format("%.3f", group.getMeanSimilarity()), group.getType().getValue());
            }
        } catch (PipelineException e) {
            if ("DUPLICATE_SCAN_BUSY".equals(e.getCode())) {
                log.info("DUPLICATE_REPORT_SKIPPED reason=scan already running");
            } else {
                log.warn("DUPLICATE_REPORT_FAILED code={} msg={}", e.getCode(), e.getMessage());
            }
        }
    }
}
