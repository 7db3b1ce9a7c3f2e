package com.example.filmarchive.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ImageTagEntity {

    private Long id;

    private Long imageId;

    private String tag;

    /**
     * "ai" or "manual".
     */
    private String source;

    private Double confidence;

    private String category;

    private LocalDateTime createdAt;
}
