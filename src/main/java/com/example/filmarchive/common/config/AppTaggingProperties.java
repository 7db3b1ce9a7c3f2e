package com.example.filmarchive.common.config;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.tagging")
public class AppTaggingProperties {

    private boolean enabled = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.15D;
}
