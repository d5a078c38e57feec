package com.energy.anomaly.engine.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered set of feature columns chosen for a batch. Decided once per batch and
 * frozen into the fitted model, so training and scoring vectors line up column by column.
 */
public final class FeatureLayout {

    private final List<Feature> features;

    private FeatureLayout(Set<Feature> features) {
        // EnumSet iteration follows declaration order.
        this.features = Collections.unmodifiableList(new ArrayList<>(EnumSet.copyOf(features)));
    }

    public static FeatureLayout of(Feature first, Feature... rest) {
        return new FeatureLayout(EnumSet.of(first, rest));
    }

    public static FeatureLayout of(Set<Feature> features) {
        if (features.isEmpty()) {
            throw new IllegalArgumentException("A feature layout needs at least one feature");
        }
        return new FeatureLayout(features);
    }

    public List<Feature> getFeatures() {
        return features;
    }

    public boolean contains(Feature feature) {
        return features.contains(feature);
    }

    public int size() {
        return features.size();
    }

    public boolean needsTimestamps() {
        return contains(Feature.HOUR_OF_DAY) || contains(Feature.DAY_OF_WEEK);
    }

    public List<String> displayNames() {
        return features.stream().map(Feature::getDisplayName).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureLayout other)) return false;
        return features.equals(other.features);
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureLayout" + features;
    }
}
