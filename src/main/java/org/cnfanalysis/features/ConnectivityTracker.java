package org.cnfanalysis.features;

import org.cnfanalysis.support.DenseIndex;
import org.cnfanalysis.support.UnionFind;

/**
 * COMPONENTI CONNESSE - Union-find sul grafo delle variabili o dei letterali
 *
 * Ogni clausola collega tutti i suoi nodi: basta unire ciascun nodo successivo
 * al primo. Il numero di nodi cresce con le entità osservate e non dipende
 * dall'header, quindi anche variabili fuori dal range dichiarato sono tracciate.
 *
 * Nel grafo dei letterali le due polarità di una variabile sono nodi distinti,
 * collegati solo se compaiono insieme in qualche clausola.
 */
public final class ConnectivityTracker implements FeatureAggregator {

    /**
     * Tipo di nodo del grafo.
     */
    public enum Mode {
        VARIABLE("connected_variable_components_count"),
        LITERAL("connected_literal_components_count");

        private final String featureName;

        Mode(String featureName) {
            this.featureName = featureName;
        }

        public String getFeatureName() {
            return featureName;
        }
    }

    private final Mode mode;
    private final DenseIndex nodes = new DenseIndex();
    private final UnionFind components = new UnionFind();

    public ConnectivityTracker(Mode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Modalità del grafo obbligatoria");
        }
        this.mode = mode;
    }

    @Override
    public void accept(int[] clause, int length) {
        if (length == 0) {
            return;
        }
        int first = nodeOf(clause[0]);
        for (int i = 1; i < length; i++) {
            components.union(first, nodeOf(clause[i]));
        }
    }

    private int nodeOf(int literal) {
        int key = mode == Mode.VARIABLE ? Math.abs(literal) : literal;
        int slot = nodes.slotOf(key);
        if (slot == components.nodeCount()) {
            components.addNode();
        }
        return slot;
    }

    public long componentCount() {
        return components.componentCount();
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        features.put(mode.getFeatureName(), componentCount());
    }
}
