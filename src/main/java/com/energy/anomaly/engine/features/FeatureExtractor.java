package com.energy.anomaly.engine.features;

import com.energy.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an ordered reading sequence into one feature vector per reading.
 *
 * Features (present depending on the batch):
 *   VALUE           raw energy output, always present
 *   ROLLING_MEAN    mean of the trailing window of 3 (partial windows at the start)
 *   ROLLING_STD     sample std of the trailing window of 3, 0 for a single sample
 *   HOUR_OF_DAY     0-23, only if every timestamp parses
 *   DAY_OF_WEEK     0 = Monday .. 6 = Sunday, only if every timestamp parses
 *   RATE_OF_CHANGE  first difference, 0 for the first reading, only if length > 1
 *
 * Missing optional inputs shrink the layout for the whole batch; they are never an error.
 * A batch scored against an older layout gets neutral values for columns it cannot supply.
 */
public final class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    public static final int ROLLING_WINDOW = 3;

    private FeatureExtractor() {}

    /**
     * Chooses the feature columns that this batch can supply.
     *
     * @param readings   ordered readings, at least one
     * @param sequential whether the readings form a sequence (enables rolling statistics)
     */
    public static FeatureLayout layoutFor(List<Reading> readings, boolean sequential) {
        requireNonEmpty(readings);

        Set<Feature> features = EnumSet.of(Feature.VALUE);
        if (sequential) {
            features.add(Feature.ROLLING_MEAN);
            features.add(Feature.ROLLING_STD);
        }

        if (parseAll(readings) != null) {
            features.add(Feature.HOUR_OF_DAY);
            features.add(Feature.DAY_OF_WEEK);
        } else {
            log.warn("Timestamps missing or unparseable in batch of {} readings. Calendar features omitted.",
                    readings.size());
        }

        if (readings.size() > 1) {
            features.add(Feature.RATE_OF_CHANGE);
        } else {
            log.debug("Single-reading batch. Rate of change omitted.");
        }

        return FeatureLayout.of(features);
    }

    /**
     * Extracts vectors for the given layout. Rate of change is 0 for the first reading
     * and rolling statistics degenerate gracefully, so any layout works for any length.
     * Calendar columns need parseable timestamps.
     *
     * @throws IllegalArgumentException when the layout has calendar columns and a timestamp does not parse
     */
    public static double[][] extract(List<Reading> readings, FeatureLayout layout) {
        return extract(readings, layout, null);
    }

    /**
     * Extracts vectors for a layout frozen at fit time. When the readings cannot supply the
     * calendar columns, those columns take the matching entry of {@code calendarFallback}
     * (the training column means) and the batch is still scored.
     *
     * @param calendarFallback one value per layout column, or null to require timestamps
     */
    public static double[][] extract(List<Reading> readings, FeatureLayout layout, double[] calendarFallback) {
        requireNonEmpty(readings);
        if (calendarFallback != null && calendarFallback.length != layout.size()) {
            throw new IllegalArgumentException(String.format(
                    "Fallback has %d values but the layout has %d columns", calendarFallback.length, layout.size()));
        }

        int n = readings.size();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = readings.get(i).getValue();
        }

        LocalDateTime[] timestamps = null;
        if (layout.needsTimestamps()) {
            timestamps = parseAll(readings);
            if (timestamps == null) {
                if (calendarFallback == null) {
                    throw new IllegalArgumentException(
                            "Calendar features need parseable timestamps on every reading");
                }
                log.warn("Timestamps missing or unparseable in batch of {} readings. "
                        + "Calendar features held at their training means.", n);
            }
        }

        List<Feature> columns = layout.getFeatures();
        double[][] rows = new double[n][columns.size()];
        for (int i = 0; i < n; i++) {
            for (int c = 0; c < columns.size(); c++) {
                rows[i][c] = switch (columns.get(c)) {
                    case VALUE -> values[i];
                    case ROLLING_MEAN -> rollingMean(values, i);
                    case ROLLING_STD -> rollingStd(values, i);
                    case HOUR_OF_DAY -> timestamps != null ? timestamps[i].getHour() : calendarFallback[c];
                    case DAY_OF_WEEK -> timestamps != null
                            ? timestamps[i].getDayOfWeek().getValue() - 1
                            : calendarFallback[c];
                    case RATE_OF_CHANGE -> i == 0 ? 0.0 : values[i] - values[i - 1];
                };
            }
        }
        return rows;
    }

    static double rollingMean(double[] values, int index) {
        int start = Math.max(0, index - ROLLING_WINDOW + 1);
        double sum = 0.0;
        for (int i = start; i <= index; i++) {
            sum += values[i];
        }
        return sum / (index - start + 1);
    }

    static double rollingStd(double[] values, int index) {
        int start = Math.max(0, index - ROLLING_WINDOW + 1);
        int count = index - start + 1;
        if (count < 2) {
            return 0.0;
        }
        double mean = rollingMean(values, index);
        double sq = 0.0;
        for (int i = start; i <= index; i++) {
            double d = values[i] - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (count - 1));
    }

    // Returns null unless every timestamp parses.
    private static LocalDateTime[] parseAll(List<Reading> readings) {
        List<LocalDateTime> parsed = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            Optional<LocalDateTime> ts = ReadingTimestamps.parse(reading.getTimestamp());
            if (ts.isEmpty()) {
                return null;
            }
            parsed.add(ts.get());
        }
        return parsed.toArray(new LocalDateTime[0]);
    }

    private static void requireNonEmpty(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("Feature extraction requires at least one reading");
        }
    }
}
