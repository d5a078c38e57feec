package com.energy.anomaly.service;

import com.energy.anomaly.config.MetricsConfig;
import com.energy.anomaly.engine.EnsembleAnomalyDetector;
import com.energy.anomaly.engine.EnsembleModel;
import com.energy.anomaly.model.Reading;
import com.energy.anomaly.repository.EnsembleModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fits ensemble models on historical readings and publishes them to the model repository.
 * Each fit builds a fresh snapshot; a series' model is only swapped once fitting finished.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final EnsembleAnomalyDetector detector;
    private final EnsembleModelRepository modelRepository;
    private final MetricsConfig metricsConfig;

    public ModelTrainingService(EnsembleAnomalyDetector detector,
                                EnsembleModelRepository modelRepository,
                                MetricsConfig metricsConfig) {
        this.detector = detector;
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Train a model for one series and make it the series' current model.
     *
     * @throws IllegalArgumentException when no readings are given
     */
    public EnsembleModel trainForSeries(String seriesId, List<Reading> history) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("No readings supplied to train series " + seriesId);
        }
        log.info("Training ensemble model for {} on {} readings...", seriesId, history.size());

        EnsembleModel model = detector.fit(history);
        modelRepository.save(seriesId, model);
        metricsConfig.recordModelFit(seriesId);

        log.info("Trained model for {}: {} trees, {} samples, features={}",
                seriesId, model.getOutlierModel().getTreeCount(), model.getTrainingSamples(),
                model.getLayout().displayNames());
        return model;
    }

    /**
     * Train several series. A failure for one series is logged and does not stop the others.
     *
     * @return ids of the series that were trained
     */
    public List<String> trainAll(Map<String, List<Reading>> historyBySeries) {
        log.info("=== Starting model training for {} series ===", historyBySeries.size());
        List<String> trained = new ArrayList<>();

        for (Map.Entry<String, List<Reading>> entry : historyBySeries.entrySet()) {
            try {
                trainForSeries(entry.getKey(), entry.getValue());
                trained.add(entry.getKey());
            } catch (Exception e) {
                log.error("Failed to train model for {}", entry.getKey(), e);
            }
        }

        log.info("=== Model training complete: {}/{} series ===", trained.size(), historyBySeries.size());
        return trained;
    }
}
