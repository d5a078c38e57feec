package com.energy.anomaly.repository;

import com.energy.anomaly.engine.EnsembleModel;
import com.energy.anomaly.model.ModelMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the current fitted model per series. A save replaces the previous snapshot in one
 * step, so concurrent scorers see either the old or the new model, never a partial one.
 */
@Repository
public class EnsembleModelRepository {

    private static final Logger log = LoggerFactory.getLogger(EnsembleModelRepository.class);

    private final Map<String, EnsembleModel> models = new ConcurrentHashMap<>();

    public void save(String seriesId, EnsembleModel model) {
        EnsembleModel previous = models.put(seriesId, model);
        log.info("Saved model for {}: {} trees, {} samples{}",
                seriesId, model.getOutlierModel().getTreeCount(), model.getTrainingSamples(),
                previous != null ? " (replaced previous snapshot)" : "");
    }

    /**
     * @return the fitted model, or null when the series has never been trained
     */
    public EnsembleModel load(String seriesId) {
        return models.get(seriesId);
    }

    public ModelMetadata getModelMetadata(String seriesId) {
        EnsembleModel model = models.get(seriesId);
        if (model == null) return null;

        return ModelMetadata.builder()
                .seriesId(seriesId)
                .detector(model.getDetectorName())
                .treeCount(model.getOutlierModel().getTreeCount())
                .featureNames(model.getLayout().displayNames())
                .trainingSamples(model.getTrainingSamples())
                .contamination(model.getContamination())
                .randomSeed(model.getRandomSeed())
                .trainedAt(model.getTrainedAt())
                .build();
    }

    public Set<String> findAllSeriesIds() {
        return new TreeSet<>(models.keySet());
    }

    public void delete(String seriesId) {
        models.remove(seriesId);
    }
}
