package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BatchStatus {
    SUCCESS,
    FAILED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
