package com.energy.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Aggregate over one day's alerts, written next to the alert file as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
        "export_date", "total_alerts", "severity_breakdown", "critical_alerts", "warning_alerts",
        "info_alerts", "avg_energy_output", "min_energy_output", "max_energy_output",
        "avg_deviation", "max_deviation", "primary_trend", "systems_affected", "status",
        "export_timestamp", "recommendations"
})
public class DailySummary {

    public static final String STATUS_CRITICAL = "Critical";
    public static final String STATUS_NORMAL = "Normal";

    @JsonProperty("export_date")
    private String exportDate;

    @JsonProperty("total_alerts")
    private int totalAlerts;

    // Severity label -> count, only for severities present that day.
    @JsonProperty("severity_breakdown")
    private Map<String, Long> severityBreakdown;

    @JsonProperty("critical_alerts")
    private long criticalAlerts;

    @JsonProperty("warning_alerts")
    private long warningAlerts;

    @JsonProperty("info_alerts")
    private long infoAlerts;

    @JsonProperty("avg_energy_output")
    private double avgEnergyOutput;

    @JsonProperty("min_energy_output")
    private double minEnergyOutput;

    @JsonProperty("max_energy_output")
    private double maxEnergyOutput;

    @JsonProperty("avg_deviation")
    private double avgDeviation;

    @JsonProperty("max_deviation")
    private double maxDeviation;

    @JsonProperty("primary_trend")
    private String primaryTrend;

    @JsonProperty("systems_affected")
    private long systemsAffected;

    // "Critical" if any critical alert exists, otherwise "Normal".
    @JsonProperty("status")
    private String status;

    @JsonProperty("export_timestamp")
    private String exportTimestamp;

    @JsonProperty("recommendations")
    private List<String> recommendations;
}
