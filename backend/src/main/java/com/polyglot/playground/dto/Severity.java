package com.polyglot.playground.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    ERROR("error", 8),
    WARNING("warning", 4),
    INFO("info", 2);

    private final String wireName;
    private final int markerSeverity;

    Severity(String wireName, int markerSeverity) {
        this.wireName = wireName;
        this.markerSeverity = markerSeverity;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Severity on the numeric scale used by browser code editors for inline markers.
     */
    public int markerSeverity() {
        return markerSeverity;
    }
}
