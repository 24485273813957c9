package org.cnfanalysis.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DenseIndexTest {

    @Test
    @DisplayName("Posizioni assegnate nell'ordine di prima osservazione")
    void firstSeenOrder() {
        DenseIndex index = new DenseIndex();

        assertThat(index.slotOf(2_000_000_000)).isEqualTo(0);
        assertThat(index.slotOf(-7)).isEqualTo(1);
        assertThat(index.slotOf(2_000_000_000)).isEqualTo(0);
        assertThat(index.size()).isEqualTo(2);
        assertThat(index.keyAt(1)).isEqualTo(-7);
        assertThat(index.find(42)).isEqualTo(-1);
    }

    @Test
    @DisplayName("La tabella cresce mantenendo tutte le associazioni")
    void growsAcrossRehash() {
        DenseIndex index = new DenseIndex();
        for (int key = 1; key <= 10_000; key++) {
            index.slotOf(key * 31);
        }

        assertThat(index.size()).isEqualTo(10_000);
        for (int key = 1; key <= 10_000; key++) {
            assertThat(index.find(key * 31)).isEqualTo(key - 1);
        }
    }

    @Test
    @DisplayName("La chiave 0 non è indicizzabile")
    void rejectsZero() {
        DenseIndex index = new DenseIndex();

        assertThatThrownBy(() -> index.slotOf(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(index.find(0)).isEqualTo(-1);
    }
}
