package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.PipelineStage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurrentOperation {

    private boolean processing;

    private String file;

    private PipelineStage stage;

    private int progress;

    public static CurrentOperation idle() {
        return new CurrentOperation(false, null, null, 0);
    }
}
