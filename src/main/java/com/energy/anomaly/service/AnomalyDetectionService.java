package com.energy.anomaly.service;

import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.engine.EnsembleAnomalyDetector;
import com.energy.anomaly.engine.EnsembleModel;
import com.energy.anomaly.model.DetectionSummary;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.model.ScoredReading;
import com.energy.anomaly.model.ScoringResult;
import com.energy.anomaly.model.SeverityLevel;
import com.energy.anomaly.repository.EnsembleModelRepository;
import com.energy.anomaly.repository.ScoredReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Entry point for scoring requests from the upload layer.
 *
 * Flow:
 * 1. Look up the series' fitted model (NOT_FITTED result when there is none)
 * 2. Score the readings through the ensemble
 * 3. Keep the scored batch as the series' latest, for scheduled exports
 * 4. Record metrics and log anomalies
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final EnsembleAnomalyDetector detector;
    private final EnsembleModelRepository modelRepository;
    private final ScoredReadingRepository scoredReadingRepository;
    private final ModelTrainingService trainingService;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(EnsembleAnomalyDetector detector,
                                   EnsembleModelRepository modelRepository,
                                   ScoredReadingRepository scoredReadingRepository,
                                   ModelTrainingService trainingService,
                                   MetricsConfig metricsConfig) {
        this.detector = detector;
        this.modelRepository = modelRepository;
        this.scoredReadingRepository = scoredReadingRepository;
        this.trainingService = trainingService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Score readings against the series' current model.
     */
    public ScoringResult score(String seriesId, List<Reading> readings) {
        EnsembleModel model = modelRepository.load(seriesId);
        if (model == null) {
            log.warn("Scoring requested for {} but no model has been fitted", seriesId);
            return ScoringResult.notFitted(seriesId);
        }
        return ScoringResult.scored(seriesId, scoreWith(seriesId, model, readings));
    }

    /**
     * Fit on the readings and score the same readings: the one-shot upload path.
     */
    public ScoringResult fitAndScore(String seriesId, List<Reading> readings) {
        EnsembleModel model = trainingService.trainForSeries(seriesId, readings);
        return ScoringResult.scored(seriesId, scoreWith(seriesId, model, readings));
    }

    public DetectionSummary summarize(List<ScoredReading> scored) {
        List<ScoredReading> flagged = scored.stream().filter(ScoredReading::isAnomalyFlag).toList();

        ScoredReading mostSevere = flagged.stream()
                .max(Comparator.comparingDouble(ScoredReading::getAnomalyScore))
                .orElse(null);

        return DetectionSummary.builder()
                .totalDataPoints(scored.size())
                .totalAnomalies(flagged.size())
                .anomalyRate(scored.isEmpty() ? 0.0 : flagged.size() * 100.0 / scored.size())
                .criticalAnomalies(countSeverity(flagged, SeverityLevel.CRITICAL))
                .warningAnomalies(countSeverity(flagged, SeverityLevel.WARNING))
                .infoAnomalies(countSeverity(flagged, SeverityLevel.INFO))
                .avgAnomalyScore(flagged.stream().mapToDouble(ScoredReading::getAnomalyScore).average().orElse(0.0))
                .maxAnomalyScore(mostSevere != null ? mostSevere.getAnomalyScore() : 0.0)
                .mostSevereTimestamp(mostSevere != null ? mostSevere.getTimestamp() : null)
                .build();
    }

    private List<ScoredReading> scoreWith(String seriesId, EnsembleModel model, List<Reading> readings) {
        List<ScoredReading> scored = detector.score(model, readings);
        scoredReadingRepository.saveLatest(seriesId, scored);

        long flagged = 0;
        for (ScoredReading reading : scored) {
            metricsConfig.recordScoredReading(reading.getSeverity().getLabel(), reading.getAnomalyScore());
            if (reading.isAnomalyFlag()) {
                flagged++;
            }
            if (reading.getSeverity() == SeverityLevel.CRITICAL) {
                log.warn("Critical anomaly for series={} at {}: value={}, score={}, action={}",
                        seriesId, reading.getTimestamp(), reading.getValue(),
                        String.format("%.3f", reading.getAnomalyScore()), reading.getRecommendedAction());
            }
        }
        log.info("Scored {} readings for {}: {} flagged", scored.size(), seriesId, flagged);
        return scored;
    }

    private static long countSeverity(List<ScoredReading> scored, SeverityLevel severity) {
        return scored.stream().filter(r -> r.getSeverity() == severity).count();
    }
}
