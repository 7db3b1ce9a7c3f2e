package com.example.filmarchive.domain.model;

import com.example.filmarchive.domain.enumtype.PipelineStage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusUpdate {

    private PipelineStage stage;

    private int progress;

    private String file;

    private String error;
}
