package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single energy output reading. The timestamp is kept as supplied by the upload layer
 * and may be absent or unparseable; the value is already validated.
 */
@Value
@Builder
public class Reading {

    // Raw timestamp text, e.g. "2024-01-15 06:00:00". Optional.
    String timestamp;

    // Energy output in kWh.
    double value;

    public static Reading of(String timestamp, double value) {
        return new Reading(timestamp, value);
    }
}
