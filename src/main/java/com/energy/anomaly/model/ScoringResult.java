package com.energy.anomaly.model;

import com.energy.anomaly.engine.ModelNotFittedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a scoring request. A request against a series without a fitted model
 * yields {@link Status#NOT_FITTED} instead of default scores.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ScoringResult {

    public enum Status {
        SCORED,
        NOT_FITTED
    }

    private final String seriesId;
    private final Status status;
    private final List<ScoredReading> scoredReadings;

    public static ScoringResult scored(String seriesId, List<ScoredReading> scoredReadings) {
        return new ScoringResult(seriesId, Status.SCORED, List.copyOf(scoredReadings));
    }

    public static ScoringResult notFitted(String seriesId) {
        return new ScoringResult(seriesId, Status.NOT_FITTED, Collections.emptyList());
    }

    public boolean isScored() {
        return status == Status.SCORED;
    }

    public boolean isNotFitted() {
        return status == Status.NOT_FITTED;
    }

    /**
     * @throws ModelNotFittedException when no model was available for the series
     */
    public List<ScoredReading> orElseThrow() {
        if (isNotFitted()) {
            throw new ModelNotFittedException(seriesId);
        }
        return scoredReadings;
    }
}
