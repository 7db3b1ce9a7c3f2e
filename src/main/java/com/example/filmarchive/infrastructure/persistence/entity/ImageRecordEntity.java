package com.example.filmarchive.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ImageRecordEntity {

    private Long id;

    /**
     * Name of the enhanced JPEG, unique per record.
     */
    private String filename;

    private String originalPath;

    private String archivedPath;

    private String enhancedPath;

    private Integer width;

    private Integer height;

    private Long fileSize;

    private String status;

    private Double histogramClip;

    private Double claheClip;

    private String preset;

    private Boolean faceDetected;

    private Double qualityScore;

    private LocalDateTime processedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
