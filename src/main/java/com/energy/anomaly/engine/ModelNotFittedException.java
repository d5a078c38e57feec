package com.energy.anomaly.engine;

/**
 * Scoring was requested before a model was fitted for the series.
 */
public class ModelNotFittedException extends RuntimeException {

    private final String seriesId;

    public ModelNotFittedException(String seriesId) {
        super("Model must be fitted before scoring series " + seriesId);
        this.seriesId = seriesId;
    }

    public String getSeriesId() {
        return seriesId;
    }
}
