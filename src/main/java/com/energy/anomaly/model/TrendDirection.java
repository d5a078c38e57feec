package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    DECLINING("Declining"),
    VARIABLE("Variable"),
    SINGLE_POINT("Single Point");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
