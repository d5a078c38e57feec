package com.energy.anomaly.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoredReading {

    Reading reading;

    ScoreSet scores;

    // combined > info threshold
    boolean anomalyFlag;

    SeverityLevel severity;

    String recommendedAction;

    public double getValue() {
        return reading.getValue();
    }

    public String getTimestamp() {
        return reading.getTimestamp();
    }

    public double getAnomalyScore() {
        return scores.getCombined();
    }
}
