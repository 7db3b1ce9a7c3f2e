package com.example.filmarchive.common.config;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.duplicate")
public class AppDuplicateProperties {

    /**
     * Minimum hash similarity for two frames to count as near duplicates.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.95D;

    /**
     * Cron for the duplicate report job. "-" disables it.
     */
    private String reportCron = "-";
}
