package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States a file passes through inside the orchestrator. ERROR is terminal and reachable
 * from any state before COMPLETE.
 */
public enum PipelineStage {

    QUEUED("queued", 0),
    INGESTING("ingesting", 10),
    ENHANCING("enhancing", 40),
    SAVING("saving", 70),
    TAGGING("tagging", 90),
    COMPLETE("complete", 100),
    ERROR("error", 0);

    private final String value;
    private final int progress;

    PipelineStage(String value, int progress) {
        this.value = value;
        this.progress = progress;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getProgress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
