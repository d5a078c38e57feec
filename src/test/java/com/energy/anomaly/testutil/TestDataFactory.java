package com.energy.anomaly.testutil;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.EnsembleAnomalyDetector;
import com.energy.anomaly.engine.isolationforest.IsolationForestDetector;
import com.energy.anomaly.engine.scoring.RecommendationEngine;
import com.energy.anomaly.engine.scoring.ScoreCombiner;
import com.energy.anomaly.engine.scoring.SeverityClassifier;
import com.energy.anomaly.engine.scoring.SpcScorer;
import com.energy.anomaly.engine.scoring.ZScoreScorer;
import com.energy.anomaly.model.Alert;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoreSet;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.model.SeverityLevel;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // 2024-01-16 00:05:00 UTC, just after midnight of the day following the sample data.
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-16T00:05:00Z"), ZoneOffset.UTC);

    private TestDataFactory() {}

    public static List<Reading> hourlyReadings(LocalDateTime start, double... values) {
        List<Reading> readings = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            readings.add(Reading.of(TS_FORMAT.format(start.plusHours(i)), values[i]));
        }
        return readings;
    }

    public static List<Reading> untimedReadings(double... values) {
        List<Reading> readings = new ArrayList<>(values.length);
        for (double value : values) {
            readings.add(Reading.of(null, value));
        }
        return readings;
    }

    /**
     * Hourly output oscillating between 496 and 504 kWh.
     */
    public static double[] steadyValues(int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = 500.0 + ((i % 5) - 2) * 2.0;
        }
        return values;
    }

    public static DetectionConfig detectionConfig() {
        DetectionConfig config = new DetectionConfig();
        config.setNumTrees(100);
        config.setSampleSize(256);
        config.setContamination(0.1);
        config.setRandomSeed(42L);
        return config;
    }

    public static EnsembleAnomalyDetector ensembleDetector(DetectionConfig config, Clock clock) {
        return new EnsembleAnomalyDetector(
                config,
                new IsolationForestDetector(config),
                new ZScoreScorer(),
                new SpcScorer(config),
                new ScoreCombiner(config),
                new SeverityClassifier(config),
                new RecommendationEngine(config),
                clock);
    }

    public static ScoredReading createScoredReading(String timestamp, double value,
                                                    SeverityLevel severity, double combined) {
        return ScoredReading.builder()
                .reading(Reading.of(timestamp, value))
                .scores(ScoreSet.builder().combined(combined).build())
                .anomalyFlag(combined > 0.3)
                .severity(severity)
                .recommendedAction(severity == SeverityLevel.CRITICAL
                        ? RecommendationEngine.INSPECT_EQUIPMENT
                        : RecommendationEngine.NOTE_PATTERN)
                .build();
    }

    public static Alert createAlert(int id, double energyKwh, SeverityLevel severity,
                                    double deviation, String trend) {
        return Alert.builder()
                .alertId(id)
                .timestamp("2024-01-15 0" + (id % 10) + ":00:00")
                .energyKwh(energyKwh)
                .severity(severity.getLabel())
                .anomalyScore(0.9)
                .deviationPercentage(deviation)
                .expectedMin(0.0)
                .expectedMax(600.0)
                .systemStatus(severity.getSystemStatus())
                .recommendedAction(RecommendationEngine.NOTE_PATTERN)
                .unitsAffected("Primary System")
                .trendDirection(trend)
                .createdAt("2024-01-16 00:05:00")
                .build();
    }
}
