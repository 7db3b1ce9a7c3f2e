package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.PipelineStage;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorRecord {

    private String filename;

    private String message;

    private Instant timestamp;

    private PipelineStage stage;
}
