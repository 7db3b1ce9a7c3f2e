package com.example.filmarchive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagInfo {

    private String label;

    /**
     * In [0, 1].
     */
    private double confidence;

    private String category;
}
