package com.example.filmarchive.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bytedeco.opencv.opencv_core.Mat;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnhancementResult {

    /**
     * 8-bit BGR pixels of the enhanced frame.
     */
    @JsonIgnore
    private Mat enhanced;

    private int originalWidth;

    private int originalHeight;

    private EnhancementParams params;

    private boolean facesDetected;

    private double qualityScore;
}
