package com.energy.anomaly.engine.scoring;

import com.energy.anomaly.config.DetectionConfig;
import com.energy.anomaly.model.ScoreSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreCombinerTest {

    private ScoreCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new ScoreCombiner(new DetectionConfig());
    }

    @Test
    void combine_weightedSumOfNormalizedSignals() {
        List<ScoreSet> result = combiner.combine(
                new double[]{-0.2, 0.1},
                new double[]{4.0, 2.0},
                new double[]{0.0, 6.0});

        // first: iso 1.0, z 1.0, spc 0.0 -> 0.5 + 0.3
        assertThat(result.get(0).getIsolationNormalized()).isCloseTo(1.0, within(1e-6));
        assertThat(result.get(0).getCombined()).isCloseTo(0.8, within(1e-6));
        // second: iso 0.0, z 0.5, spc 1.0 -> 0.15 + 0.2
        assertThat(result.get(1).getZNormalized()).isCloseTo(0.5, within(1e-12));
        assertThat(result.get(1).getSpcNormalized()).isEqualTo(1.0);
        assertThat(result.get(1).getCombined()).isCloseTo(0.35, within(1e-6));
    }

    @Test
    void combine_keepsRawScores() {
        ScoreSet set = combiner.combine(new double[]{0.05}, new double[]{1.5}, new double[]{0.25}).get(0);

        assertThat(set.getIsolationScore()).isEqualTo(0.05);
        assertThat(set.getZScore()).isEqualTo(1.5);
        assertThat(set.getSpcScore()).isEqualTo(0.25);
    }

    @Test
    void normalizeIsolation_equalScores_mapToOne() {
        assertThat(combiner.normalizeIsolation(new double[]{0.1, 0.1, 0.1})).containsExactly(1.0, 1.0, 1.0);
    }

    @Test
    void combine_extremeInputs_stayWithinUnitInterval() {
        List<ScoreSet> result = combiner.combine(
                new double[]{-5.0, 0.0, 3.0, 0.2},
                new double[]{0.0, 1e9, Double.NaN, 3.9},
                new double[]{1e12, 0.0, 2.9, Double.POSITIVE_INFINITY});

        for (ScoreSet set : result) {
            assertThat(set.getCombined()).isBetween(0.0, 1.0);
            assertThat(set.getIsolationNormalized()).isBetween(0.0, 1.0);
            assertThat(set.getZNormalized()).isBetween(0.0, 1.0);
            assertThat(set.getSpcNormalized()).isBetween(0.0, 1.0);
        }
    }

    @Test
    void combine_lengthMismatch_throws() {
        assertThatThrownBy(() -> combiner.combine(new double[2], new double[2], new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_weightsNotSummingToOne_throws() {
        DetectionConfig config = new DetectionConfig();
        config.getWeights().setSpc(0.5);

        assertThatThrownBy(() -> new ScoreCombiner(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("weights");
    }

    @Test
    void constructor_descendingThresholds_rejected() {
        DetectionConfig config = new DetectionConfig();
        config.getThresholds().setWarning(0.9);

        assertThatThrownBy(() -> new ScoreCombiner(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ascending");
    }

    @Test
    void constructor_contaminationOutOfRange_rejected() {
        DetectionConfig config = new DetectionConfig();
        config.setContamination(0.6);

        assertThatThrownBy(() -> new ScoreCombiner(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination");
    }
}
