package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered severity grades. Declaration order is the severity order.
 */
public enum SeverityLevel {
    NORMAL("Normal", "Operating Normally"),
    INFO("Info", "Normal Operation"),
    WARNING("Warning", "Monitoring Required"),
    CRITICAL("Critical", "Requires Immediate Attention");

    private final String label;
    private final String systemStatus;

    SeverityLevel(String label, String systemStatus) {
        this.label = label;
        this.systemStatus = systemStatus;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getSystemStatus() {
        return systemStatus;
    }

    // A score equal to a threshold meets it.
    public static SeverityLevel fromScore(double score, double info, double warning, double critical) {
        if (score >= critical) return CRITICAL;
        if (score >= warning) return WARNING;
        if (score >= info) return INFO;
        return NORMAL;
    }
}
