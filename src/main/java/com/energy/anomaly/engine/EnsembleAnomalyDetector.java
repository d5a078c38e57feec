package com.energy.anomaly.engine;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.engine.features.FeatureExtractor;
import com.energy.anomaly.engine.features.FeatureLayout;
import com.energy.anomaly.engine.scoring.BaselineStats;
import com.energy.anomaly.engine.scoring.RecommendationEngine;
import com.energy.anomaly.engine.scoring.ScoreCombiner;
import com.energy.anomaly.engine.scoring.SeverityClassifier;
import com.energy.anomaly.engine.scoring.SpcScorer;
import com.energy.anomaly.engine.scoring.ZScoreScorer;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoreSet;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.model.SeverityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-signal anomaly scoring.
 *
 * Flow:
 * 1. Extract feature vectors (layout frozen at fit time)
 * 2. Outlier model decision values
 * 3. Z-score and SPC scores against the training baseline
 * 4. Normalize and fuse into one combined score
 * 5. Classify severity and attach a recommended action
 *
 * Fitting returns an {@link EnsembleModel} snapshot; scoring reads it and never changes it.
 */
@Component
public class EnsembleAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(EnsembleAnomalyDetector.class);

    private final DetectionConfig config;
    private final OutlierDetector outlierDetector;
    private final ZScoreScorer zScoreScorer;
    private final SpcScorer spcScorer;
    private final ScoreCombiner scoreCombiner;
    private final SeverityClassifier severityClassifier;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;

    public EnsembleAnomalyDetector(DetectionConfig config,
                                   OutlierDetector outlierDetector,
                                   ZScoreScorer zScoreScorer,
                                   SpcScorer spcScorer,
                                   ScoreCombiner scoreCombiner,
                                   SeverityClassifier severityClassifier,
                                   RecommendationEngine recommendationEngine,
                                   Clock clock) {
        config.validate();
        this.config = config;
        this.outlierDetector = outlierDetector;
        this.zScoreScorer = zScoreScorer;
        this.spcScorer = spcScorer;
        this.scoreCombiner = scoreCombiner;
        this.severityClassifier = severityClassifier;
        this.recommendationEngine = recommendationEngine;
        this.clock = clock;
    }

    /**
     * Fit the ensemble on historical readings.
     *
     * @param readings ordered training readings, at least one
     * @return an immutable model snapshot
     */
    public EnsembleModel fit(List<Reading> readings) {
        FeatureLayout layout = FeatureExtractor.layoutFor(readings, config.isSequentialFeatures());
        double[][] features = FeatureExtractor.extract(readings, layout);

        FittedOutlierModel outlierModel = outlierDetector.fit(
                features, config.getContamination(), config.getRandomSeed());
        BaselineStats baseline = BaselineStats.of(values(readings));

        log.info("Fitted ensemble on {} readings: detector={}, scorers=[{}, {}], features={}, {}",
                readings.size(), outlierDetector.getName(), zScoreScorer.getName(), spcScorer.getName(),
                layout.displayNames(), baseline);

        return EnsembleModel.builder()
                .layout(layout)
                .outlierModel(outlierModel)
                .baseline(baseline)
                .detectorName(outlierDetector.getName())
                .contamination(config.getContamination())
                .randomSeed(config.getRandomSeed())
                .trainingSamples(readings.size())
                .trainedAt(clock.millis())
                .build();
    }

    /**
     * Score readings against a fitted model. Returns a new list; the input is not touched.
     * Calendar columns the readings cannot supply are filled with the training means.
     */
    public List<ScoredReading> score(EnsembleModel model, List<Reading> readings) {
        double[][] features = FeatureExtractor.extract(
                readings, model.getLayout(), model.getOutlierModel().getFeatureMeans());
        double[] values = values(readings);

        double[] isolationScores = model.getOutlierModel().score(features);
        double[] zScores = zScoreScorer.score(values, model.getBaseline());
        double[] spcScores = spcScorer.score(values, model.getBaseline());
        List<ScoreSet> scoreSets = scoreCombiner.combine(isolationScores, zScores, spcScores);

        double batchMean = BaselineStats.of(values).getMean();

        List<ScoredReading> scored = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {
            ScoreSet scores = scoreSets.get(i);
            SeverityLevel severity = severityClassifier.classify(scores.getCombined());
            scored.add(ScoredReading.builder()
                    .reading(readings.get(i))
                    .scores(scores)
                    .anomalyFlag(severityClassifier.isAnomalous(scores.getCombined()))
                    .severity(severity)
                    .recommendedAction(recommendationEngine.recommend(severity, values[i], batchMean))
                    .build());
        }
        return scored;
    }

    private static double[] values(List<Reading> readings) {
        double[] values = new double[readings.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = readings.get(i).getValue();
        }
        return values;
    }
}
