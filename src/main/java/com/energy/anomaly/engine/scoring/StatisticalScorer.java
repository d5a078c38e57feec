package com.energy.anomaly.engine.scoring;

/**
 * A univariate detector that scores raw values against a baseline.
 * Higher scores are more anomalous; 0 means nothing to report.
 */
public interface StatisticalScorer {

    String getName();

    double[] score(double[] values, BaselineStats baseline);
}
