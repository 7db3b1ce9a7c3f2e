package com.example.filmarchive.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {

    STALL_WARNING("stall_warning", "warning"),
    PERFORMANCE_DEGRADATION("performance_degradation", "info"),
    HIGH_ERROR_RATE("high_error_rate", "error"),
    ALL_ERRORS("all_errors", "error");

    private final String value;
    private final String severity;

    AlertType(String value, String severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSeverity() {
        return severity;
    }
}
