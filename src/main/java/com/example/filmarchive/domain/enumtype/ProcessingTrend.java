package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingTrend {

    STABLE("stable"),
    DEGRADING("degrading"),
    ACCELERATING("accelerating");

    private final String value;

    ProcessingTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
