package com.example.filmarchive.common.config;

import com.example.filmarchive.domain.enumtype.EnhancementPreset;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.enhance")
public class AppEnhanceProperties {

    /**
     * Percentage clipped from each histogram tail during auto-levels.
     */
    @DecimalMin("0.0")
    @DecimalMax("50.0")
    private double histogramClip = 0.5D;

    /**
     * Contrast limit handed to CLAHE.
     */
    @DecimalMin("0.1")
    private double claheClipLimit = 1.5D;

    /**
     * Size the CLAHE tile grid from the frame resolution instead of a fixed 8x8.
     */
    private boolean adaptiveGrid = true;

    private boolean faceDetection = true;

    /**
     * Haar cascade XML used for face-aware softening. Feature is skipped when missing.
     */
    private String faceCascadePath = "./models/haarcascade_frontalface_default.xml";

    /**
     * Try every preset and keep the best scoring output.
     */
    private boolean autoQuality = true;

    /**
     * Fixed preset for every frame. Takes precedence over auto-quality when set.
     */
    private EnhancementPreset preset;

    @Min(1)
    @Max(100)
    private int jpegQuality = 95;

    private boolean enablePngArchive = false;

    private boolean enableTiffArchive = false;

    private boolean enableJpegXl = false;
}
