package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw and normalized scores for one reading.
 * The normalized components and the combined score all lie in [0, 1].
 */
@Value
@Builder
public class ScoreSet {

    // Outlier model decision value. Lower = more anomalous.
    double isolationScore;

    // |value - mean| / std against the baseline.
    double zScore;

    // Distance beyond the 3-sigma control limits, in standard deviations.
    double spcScore;

    double isolationNormalized;
    double zNormalized;
    double spcNormalized;

    // Weighted sum of the three normalized components.
    double combined;
}
