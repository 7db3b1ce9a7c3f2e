package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.AlertType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineAlert {

    private AlertType type;

    private String severity;

    private String message;

    private Instant timestamp;

    public static PipelineAlert of(AlertType type, String message, Instant timestamp) {
        return new PipelineAlert(type, type.getSeverity(), message, timestamp);
    }
}
