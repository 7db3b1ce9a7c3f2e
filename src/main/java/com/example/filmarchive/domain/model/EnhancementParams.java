package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.EnhancementPreset;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnhancementParams {

    private double histogramClip;

    private double claheClipLimit;

    private int tileGridWidth;

    private int tileGridHeight;

    /**
     * Preset picked by auto-quality or requested explicitly; null for configured defaults.
     */
    private EnhancementPreset preset;
}
