package org.cnfanalysis.features;

import org.cnfanalysis.dimacs.ClauseListener;
import org.cnfanalysis.dimacs.HeaderDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ASSEMBLATORE DELLE METRICHE - Distribuzione delle clausole e composizione del risultato
 *
 * Riceve ogni clausola dal parser e la inoltra, in modo sincrono, a tutti gli
 * aggregatori nell'ordine di registrazione. A fine input compone la
 * {@link FeatureMap}: prima i valori dichiarati dall'header (se presente), poi le
 * metriche di ciascun aggregatore nello stesso ordine.
 */
public final class FeatureRecordAssembler implements ClauseListener {

    private final List<FeatureAggregator> aggregators;

    public FeatureRecordAssembler(List<FeatureAggregator> aggregators) {
        if (aggregators == null || aggregators.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno un aggregatore");
        }
        this.aggregators = Collections.unmodifiableList(new ArrayList<>(aggregators));
    }

    /**
     * @param extendedClauseTracking true per aggiungere il tracciamento delle clausole distinte
     * @return assemblatore con l'insieme completo degli aggregatori
     */
    public static FeatureRecordAssembler standard(boolean extendedClauseTracking) {
        List<FeatureAggregator> aggregators = new ArrayList<>();
        aggregators.add(new ClauseCountingAggregator());
        aggregators.add(new ClauseLengthAggregator());
        aggregators.add(new OccurrenceAggregator());
        aggregators.add(new ConnectivityTracker(ConnectivityTracker.Mode.VARIABLE));
        aggregators.add(new ConnectivityTracker(ConnectivityTracker.Mode.LITERAL));
        aggregators.add(new TrivialityAggregator());
        if (extendedClauseTracking) {
            aggregators.add(new ClauseUniquenessAggregator());
        }
        return new FeatureRecordAssembler(aggregators);
    }

    @Override
    public void onClause(int[] literals, int length) {
        for (FeatureAggregator aggregator : aggregators) {
            aggregator.accept(literals, length);
        }
    }

    /**
     * @param header header dichiarato, null se assente
     * @return metriche assemblate; lo stato degli aggregatori non viene modificato
     */
    public FeatureMap assemble(HeaderDeclaration header) {
        FeatureMap.Builder features = FeatureMap.builder();
        if (header != null) {
            features.put("nbvars", (long) header.variables())
                    .put("nbclauses", header.clauses());
        }
        for (FeatureAggregator aggregator : aggregators) {
            aggregator.contributeTo(features);
        }
        return features.build();
    }

    public List<FeatureAggregator> getAggregators() {
        return aggregators;
    }
}
