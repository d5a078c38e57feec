package com.energy.anomaly.engine.features;

/**
 * Feature columns in the order they appear in a feature vector.
 */
public enum Feature {
    VALUE("Energy Output"),
    ROLLING_MEAN("Rolling Mean (3)"),
    ROLLING_STD("Rolling Std (3)"),
    HOUR_OF_DAY("Hour-of-Day"),
    DAY_OF_WEEK("Day-of-Week"),
    RATE_OF_CHANGE("Rate of Change");

    private final String displayName;

    Feature(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
