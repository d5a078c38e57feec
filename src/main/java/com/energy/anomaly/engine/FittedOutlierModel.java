package com.energy.anomaly.engine;

/**
 * A fitted, read-only outlier model. Safe for concurrent scoring.
 */
public interface FittedOutlierModel {

    /**
     * One decision value per row. Lower values are more anomalous; negative values
     * fall below the contamination offset.
     */
    double[] score(double[][] features);

    int getFeatureCount();

    /**
     * Training mean of every feature column. A column held at its mean carries no
     * outlier signal.
     */
    double[] getFeatureMeans();

    int getTreeCount();
}
