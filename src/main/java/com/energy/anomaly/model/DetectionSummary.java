package com.energy.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Batch-level statistics over the flagged readings of one scoring run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionSummary {

    private int totalDataPoints;

    private int totalAnomalies;

    // Flagged / total, as a percentage.
    private double anomalyRate;

    private long criticalAnomalies;

    private long warningAnomalies;

    private long infoAnomalies;

    private double avgAnomalyScore;

    private double maxAnomalyScore;

    // Timestamp of the highest-scoring flagged reading, null when nothing was flagged.
    private String mostSevereTimestamp;
}
