package org.cnfanalysis.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RunningMomentsTest {

    @Test
    @DisplayName("Welford: media e varianza di popolazione")
    void meanAndVariance() {
        RunningMoments moments = new RunningMoments();
        for (double value : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            moments.add(value);
        }

        assertThat(moments.getCount()).isEqualTo(8);
        assertThat(moments.getMean()).isCloseTo(5.0, within(1e-12));
        assertThat(moments.getPopulationVariance()).isCloseTo(4.0, within(1e-12));
        assertThat(moments.getPopulationStandardDeviation()).isCloseTo(2.0, within(1e-12));
        assertThat(moments.getSmallest()).isEqualTo(2.0);
        assertThat(moments.getLargest()).isEqualTo(9.0);
    }

    @Test
    @DisplayName("Un'osservazione pesata equivale a osservazioni ripetute")
    void weightedEqualsRepeated() {
        RunningMoments weighted = new RunningMoments();
        weighted.add(3.0, 4);
        weighted.add(10.0, 2);

        RunningMoments repeated = new RunningMoments();
        for (int i = 0; i < 4; i++) {
            repeated.add(3.0);
        }
        repeated.add(10.0);
        repeated.add(10.0);

        assertThat(weighted.getMean()).isCloseTo(repeated.getMean(), within(1e-12));
        assertThat(weighted.getPopulationVariance()).isCloseTo(repeated.getPopulationVariance(), within(1e-9));
        assertThat(weighted.getSum()).isEqualTo(32.0);
    }

    @Test
    @DisplayName("Stabilità numerica con valori grandi e vicini")
    void numericalStability() {
        RunningMoments moments = new RunningMoments();
        moments.add(1e9 + 4);
        moments.add(1e9 + 7);
        moments.add(1e9 + 13);
        moments.add(1e9 + 16);

        assertThat(moments.getPopulationVariance()).isCloseTo(22.5, within(1e-6));
    }

    @Test
    @DisplayName("Senza osservazioni gli estremi non sono definiti")
    void empty() {
        RunningMoments moments = new RunningMoments();

        assertThat(moments.isEmpty()).isTrue();
        assertThat(moments.getSmallest()).isNaN();
        assertThat(moments.getLargest()).isNaN();
    }
}
