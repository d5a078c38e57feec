package com.energy.anomaly.engine;

/**
 * An unsupervised multivariate outlier detector.
 * Fitting never mutates the detector; it returns an immutable fitted model.
 */
public interface OutlierDetector {

    /**
     * Short name for logs and model metadata.
     */
    String getName();

    /**
     * Fit on historical feature vectors.
     *
     * @param features      training matrix, one row per reading
     * @param contamination expected anomaly fraction, used to place the decision offset
     * @param seed          random seed; equal seeds and inputs give equal models
     * @return the fitted model
     */
    FittedOutlierModel fit(double[][] features, double contamination, long seed);
}
