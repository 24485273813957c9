package org.cnfanalysis.features;

/**
 * Banalità della formula: vera se priva di clausole, falsa se contiene la clausola vuota.
 */
public final class TrivialityAggregator implements FeatureAggregator {

    private long clauses = 0;
    private boolean emptyClauseSeen = false;

    @Override
    public void accept(int[] clause, int length) {
        clauses++;
        if (length == 0) {
            emptyClauseSeen = true;
        }
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        features.put("true_trivial", clauses == 0)
                .put("false_trivial", emptyClauseSeen);
    }
}
