package org.cnfanalysis.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FrequencyHistogramTest {

    @Test
    @DisplayName("Riepilogo esatto: somma, media, estremi, mediana pari e deviazione standard di popolazione")
    void summaryOfSmallValues() {
        FrequencyHistogram histogram = new FrequencyHistogram();
        for (long value : new long[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            histogram.add(value);
        }

        DistributionSummary summary = histogram.summarize();

        assertThat(summary.count()).isEqualTo(8);
        assertThat(summary.sum()).isEqualTo(40);
        assertThat(summary.mean()).isEqualTo(5.0);
        assertThat(summary.standardDeviation()).isCloseTo(2.0, within(1e-12));
        assertThat(summary.smallest()).isEqualTo(2);
        assertThat(summary.largest()).isEqualTo(9);
        assertThat(summary.median()).isEqualTo(4.5);
    }

    @Test
    @DisplayName("Mediana con numero dispari di osservazioni")
    void oddMedian() {
        FrequencyHistogram histogram = new FrequencyHistogram();
        histogram.add(1, 2);
        histogram.add(10);

        assertThat(histogram.summarize().median()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Valori oltre la parte densa restano ordinati e conteggiati")
    void sparseValues() {
        FrequencyHistogram histogram = new FrequencyHistogram();
        histogram.add(5_000);
        histogram.add(3);
        histogram.add(1_000_000, 2);

        DistributionSummary summary = histogram.summarize();

        assertThat(histogram.distinctValues()).isEqualTo(3);
        assertThat(summary.smallest()).isEqualTo(3);
        assertThat(summary.largest()).isEqualTo(1_000_000);
        assertThat(summary.median()).isEqualTo((5_000 + 1_000_000) / 2.0);
        assertThat(summary.sum()).isEqualTo(2_005_003);
    }

    @Test
    @DisplayName("Entropia in bit sulle frequenze relative dei valori")
    void entropy() {
        FrequencyHistogram uniform = new FrequencyHistogram();
        uniform.add(1);
        uniform.add(2);
        uniform.add(3);
        uniform.add(4);

        FrequencyHistogram constant = new FrequencyHistogram();
        constant.add(7, 10);

        assertThat(uniform.summarize().entropy()).isCloseTo(2.0, within(1e-12));
        assertThat(constant.summarize().entropy()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Istogramma vuoto senza riepilogo e valori negativi rifiutati")
    void invalidUsage() {
        FrequencyHistogram histogram = new FrequencyHistogram();

        assertThat(histogram.isEmpty()).isTrue();
        assertThatThrownBy(histogram::summarize).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> histogram.add(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
