package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DuplicateAction {

    SKIP("skip"),
    ALERT("alert"),
    NONE("none");

    private final String value;

    DuplicateAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
