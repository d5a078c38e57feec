package com.energy.anomaly.repository;

import com.energy.anomaly.model.ScoredReading;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest scored batch per series, the input of scheduled exports.
 */
@Repository
public class ScoredReadingRepository {

    private final Map<String, List<ScoredReading>> latest = new ConcurrentHashMap<>();

    public void saveLatest(String seriesId, List<ScoredReading> scored) {
        latest.put(seriesId, List.copyOf(scored));
    }

    public List<ScoredReading> findLatest(String seriesId) {
        return latest.getOrDefault(seriesId, Collections.emptyList());
    }

    public Set<String> findSeriesIds() {
        return new TreeSet<>(latest.keySet());
    }
}
