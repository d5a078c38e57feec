package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One row of a daily alert export. The column set and order never change,
 * so empty and non-empty days share the same header.
 */
@Value
@Builder
@JsonPropertyOrder({
        "alert_id", "timestamp", "energy_kwh", "severity", "anomaly_score",
        "deviation_percentage", "expected_min", "expected_max", "system_status",
        "recommended_action", "units_affected", "trend_direction", "created_at"
})
public class Alert {

    public static final List<String> COLUMNS = List.of(
            "alert_id", "timestamp", "energy_kwh", "severity", "anomaly_score",
            "deviation_percentage", "expected_min", "expected_max", "system_status",
            "recommended_action", "units_affected", "trend_direction", "created_at");

    // Dense 1..N within a day.
    @JsonProperty("alert_id")
    int alertId;

    @JsonProperty("timestamp")
    String timestamp;

    @JsonProperty("energy_kwh")
    double energyKwh;

    @JsonProperty("severity")
    String severity;

    @JsonProperty("anomaly_score")
    double anomalyScore;

    @JsonProperty("deviation_percentage")
    double deviationPercentage;

    @JsonProperty("expected_min")
    double expectedMin;

    @JsonProperty("expected_max")
    double expectedMax;

    @JsonProperty("system_status")
    String systemStatus;

    @JsonProperty("recommended_action")
    String recommendedAction;

    @JsonProperty("units_affected")
    String unitsAffected;

    @JsonProperty("trend_direction")
    String trendDirection;

    @JsonProperty("created_at")
    String createdAt;
}
