package com.energy.anomaly.engine;

import com.energy.anomaly.engine.features.FeatureLayout;
import com.energy.anomaly.engine.scoring.BaselineStats;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable result of fitting the ensemble: the feature layout, the fitted outlier model
 * and the baseline for the statistical scorers. Replaced wholesale on retraining, never
 * mutated, so any number of threads may score against one instance.
 */
@Value
@Builder
public class EnsembleModel {

    FeatureLayout layout;

    FittedOutlierModel outlierModel;

    BaselineStats baseline;

    String detectorName;

    double contamination;

    long randomSeed;

    int trainingSamples;

    long trainedAt;
}
