package org.cnfanalysis.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UnionFindTest {

    @Test
    @DisplayName("Unioni e conteggio delle componenti")
    void unionsReduceComponents() {
        UnionFind uf = new UnionFind();
        for (int i = 0; i < 5; i++) {
            uf.addNode();
        }

        assertThat(uf.union(0, 1)).isTrue();
        assertThat(uf.union(3, 4)).isTrue();
        assertThat(uf.union(1, 0)).isFalse();
        assertThat(uf.componentCount()).isEqualTo(3);
        assertThat(uf.connected(0, 1)).isTrue();
        assertThat(uf.connected(1, 3)).isFalse();

        uf.union(1, 4);
        assertThat(uf.connected(0, 3)).isTrue();
        assertThat(uf.componentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Catena lunga: crescita dinamica e una sola componente")
    void longChain() {
        UnionFind uf = new UnionFind();
        int first = uf.addNode();
        for (int i = 1; i < 100_000; i++) {
            uf.union(first, uf.addNode());
        }

        assertThat(uf.nodeCount()).isEqualTo(100_000);
        assertThat(uf.componentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Nodi inesistenti sono rifiutati")
    void unknownNode() {
        UnionFind uf = new UnionFind();
        uf.addNode();

        assertThatThrownBy(() -> uf.find(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
