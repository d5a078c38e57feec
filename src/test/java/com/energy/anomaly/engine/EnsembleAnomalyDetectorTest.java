package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.features.Feature;
import com.energy.anomaly.engine.scoring.RecommendationEngine;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EnsembleAnomalyDetectorTest {

    private static final LocalDateTime HISTORY_START = LocalDateTime.of(2024, 1, 7, 0, 0);

    private EnsembleAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.detectionConfig();
        detector = TestDataFactory.ensembleDetector(config, TestDataFactory.FIXED_CLOCK);
    }

    private static List<Reading> steadyHistory(int hours) {
        return TestDataFactory.hourlyReadings(HISTORY_START, TestDataFactory.steadyValues(hours));
    }

    @Test
    void score_suddenDropAgainstSteadyHistory_isCriticalWithEquipmentInspection() {
        List<Reading> history = steadyHistory(200);
        EnsembleModel model = detector.fit(history);

        List<Reading> batch = TestDataFactory.hourlyReadings(HISTORY_START.plusHours(200), 500, 500, 500, 150);
        List<ScoredReading> scored = detector.score(model, batch);

        ScoredReading drop = scored.get(3);
        assertThat(drop.getSeverity()).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(drop.isAnomalyFlag()).isTrue();
        assertThat(drop.getAnomalyScore()).isGreaterThanOrEqualTo(0.8);
        assertThat(drop.getRecommendedAction()).isEqualTo(RecommendationEngine.INSPECT_EQUIPMENT);
        for (ScoredReading normal : scored.subList(0, 3)) {
            assertThat(normal.getSeverity()).isNotEqualTo(SeverityLevel.CRITICAL);
            assertThat(normal.getAnomalyScore()).isLessThan(drop.getAnomalyScore());
        }
    }

    @Test
    void score_sameBatchAsTraining_dropIsFlaggedButWarningOnly() {
        // Without timestamps the three 500s are indistinguishable and the drop isolates at the first split.
        List<Reading> readings = TestDataFactory.untimedReadings(500, 500, 500, 150);
        EnsembleModel model = detector.fit(readings);

        List<ScoredReading> scored = detector.score(model, readings);

        // 0.5 * 1.0 (isolation) + 0.3 * sqrt(3) / 4 (z) + 0.2 * 0 (spc, inside 3 sigma)
        assertThat(scored.get(3).getAnomalyScore()).isCloseTo(0.5 + 0.3 * Math.sqrt(3) / 4, within(1e-6));
        assertThat(scored.get(3).getSeverity()).isEqualTo(SeverityLevel.WARNING);
        assertThat(scored.get(3).getRecommendedAction()).isEqualTo(RecommendationEngine.MONITOR_AND_SCHEDULE);
        assertThat(scored.get(0).getSeverity()).isEqualTo(SeverityLevel.NORMAL);
        assertThat(scored.get(0).isAnomalyFlag()).isFalse();
    }

    @Test
    void fit_freezesLayoutAndBaseline() {
        EnsembleModel model = detector.fit(steadyHistory(50));

        assertThat(model.getLayout().getFeatures()).containsExactly(
                Feature.VALUE, Feature.ROLLING_MEAN, Feature.ROLLING_STD,
                Feature.HOUR_OF_DAY, Feature.DAY_OF_WEEK, Feature.RATE_OF_CHANGE);
        assertThat(model.getBaseline().getMean()).isCloseTo(500.0, within(1e-9));
        assertThat(model.getTrainingSamples()).isEqualTo(50);
        assertThat(model.getDetectorName()).isEqualTo("isolation-forest");
        assertThat(model.getTrainedAt()).isEqualTo(TestDataFactory.FIXED_CLOCK.millis());
    }

    @Test
    void score_repeatedCalls_returnIdenticalResults() {
        EnsembleModel model = detector.fit(steadyHistory(100));
        List<Reading> batch = TestDataFactory.hourlyReadings(HISTORY_START.plusHours(100), 510, 470, 90, 505);

        List<ScoredReading> first = detector.score(model, batch);
        List<ScoredReading> second = detector.score(model, batch);

        assertThat(first).isEqualTo(second);
        assertThat(model.getBaseline().getMean()).isCloseTo(500.0, within(1e-9));
    }

    @Test
    void score_everyCombinedScoreWithinUnitInterval() {
        EnsembleModel model = detector.fit(steadyHistory(100));
        List<Reading> batch = TestDataFactory.hourlyReadings(HISTORY_START, 0, 10_000, 500, -3, 499.5);

        for (ScoredReading reading : detector.score(model, batch)) {
            assertThat(reading.getAnomalyScore()).isBetween(0.0, 1.0);
            assertThat(reading.isAnomalyFlag()).isEqualTo(reading.getAnomalyScore() > 0.3);
        }
    }

    @Test
    void score_modelWithCalendarFeaturesAndUntimedReadings_scoresWithCalendarAtTrainingMeans() {
        EnsembleModel model = detector.fit(steadyHistory(100));
        assertThat(model.getLayout().needsTimestamps()).isTrue();

        List<ScoredReading> scored = detector.score(model, TestDataFactory.untimedReadings(500, 500, 500, 150));

        assertThat(scored).hasSize(4);
        assertThat(scored).extracting(ScoredReading::getAnomalyScore).allMatch(s -> s >= 0.0 && s <= 1.0);
        ScoredReading drop = scored.get(3);
        assertThat(drop.getSeverity()).isEqualTo(SeverityLevel.CRITICAL);
        assertThat(drop.getRecommendedAction()).isEqualTo(RecommendationEngine.INSPECT_EQUIPMENT);
        assertThat(scored.get(0).getAnomalyScore()).isLessThan(drop.getAnomalyScore());
    }

    @Test
    void score_untimedModelAcceptsTimedReadings() {
        EnsembleModel model = detector.fit(TestDataFactory.untimedReadings(TestDataFactory.steadyValues(30)));

        List<ScoredReading> scored = detector.score(model, steadyHistory(5));

        assertThat(scored).hasSize(5);
        assertThat(model.getLayout().needsTimestamps()).isFalse();
    }
}
