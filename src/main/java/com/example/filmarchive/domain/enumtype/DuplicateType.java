package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DuplicateType {

    EXACT("exact", DuplicateAction.SKIP),
    NEAR("near", DuplicateAction.ALERT),
    SIMILAR("similar", DuplicateAction.NONE);

    public static final double EXACT_SIMILARITY = 0.99D;

    private final String value;
    private final DuplicateAction action;

    DuplicateType(String value, DuplicateAction action) {
        this.value = value;
        this.action = action;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public DuplicateAction getAction() {
        return action;
    }

    public static DuplicateType classify(double similarity, double threshold) {
        if (similarity >= EXACT_SIMILARITY) {
            return EXACT;
        }
        if (similarity >= threshold) {
            return NEAR;
        }
        return SIMILAR;
    }
}
