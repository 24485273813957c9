package org.cnfanalysis.features;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * CLAUSOLE DISTINTE E COPPIE XOR - Tracciamento esteso, attivato su richiesta
 *
 * Conserva la forma canonica (letterali ordinati e senza ripetizioni) di ogni
 * clausola distinta: a differenza degli altri aggregatori la memoria cresce con
 * il numero di clausole distinte.
 *
 * Una coppia xor2 è formata da due clausole binarie {a, b} e {-a, -b}; ogni
 * clausola partecipa al più a una coppia.
 *
 * LETTERALI UNITARI DISTINTI:
 * - Per ogni variabile vista in una clausola unitaria si registrano le polarità incontrate
 * - Una variabile con entrambe le polarità rende la formula contraddittoria; si
 *   riporta l'ultima trovata
 */
public final class ClauseUniquenessAggregator implements FeatureAggregator {

    private static final int UNIT_NEGATIVE = 1;
    private static final int UNIT_POSITIVE = 2;
    private static final int UNIT_BOTH = UNIT_NEGATIVE | UNIT_POSITIVE;

    private final Set<CanonicalClause> distinct = new HashSet<>();
    private final Set<Long> pendingComplements = new HashSet<>();
    private long xorPairs = 0;

    private final Map<Integer, Integer> unitPolarities = new HashMap<>();
    private int contradictoryVariable = 0;

    @Override
    public void accept(int[] clause, int length) {
        int[] canonical = canonicalForm(clause, length);
        distinct.add(new CanonicalClause(canonical));

        if (length == 1) {
            recordUnit(clause[0]);
        }

        if (canonical.length == 2 && canonical[0] != -canonical[1]) {
            long pair = pairKey(canonical[0], canonical[1]);
            if (pendingComplements.remove(pair)) {
                xorPairs++;
            } else {
                pendingComplements.add(pairKey(-canonical[0], -canonical[1]));
            }
        }
    }

    private void recordUnit(int literal) {
        int variable = Math.abs(literal);
        int polarity = literal > 0 ? UNIT_POSITIVE : UNIT_NEGATIVE;
        int previous = unitPolarities.getOrDefault(variable, 0);
        int merged = previous | polarity;
        if (merged != previous) {
            unitPolarities.put(variable, merged);
            if (merged == UNIT_BOTH) {
                contradictoryVariable = variable;
            }
        }
    }

    static int[] canonicalForm(int[] clause, int length) {
        int[] sorted = Arrays.copyOf(clause, length);
        Arrays.sort(sorted);
        int size = 0;
        for (int i = 0; i < sorted.length; i++) {
            if (i == 0 || sorted[i] != sorted[i - 1]) {
                sorted[size++] = sorted[i];
            }
        }
        return size == sorted.length ? sorted : Arrays.copyOf(sorted, size);
    }

    private static long pairKey(int a, int b) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        return ((long) low << 32) | (high & 0xffffffffL);
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        features.put("clauses_unique_count", (long) distinct.size())
                .put("xor2_count", xorPairs);

        long positiveOnly = unitPolarities.values().stream().filter(p -> p == UNIT_POSITIVE).count();
        long negativeOnly = unitPolarities.values().stream().filter(p -> p == UNIT_NEGATIVE).count();
        features.put("literals_unit_unique_count", (long) unitPolarities.size());
        if (positiveOnly > 0) {
            features.put("literals_unit_unique_positive_count", positiveOnly);
        }
        if (negativeOnly > 0) {
            features.put("literals_unit_unique_negative_count", negativeOnly);
        }
        if (contradictoryVariable > 0) {
            features.put("literals_unit_unique_contradictory_variable", (long) contradictoryVariable);
        }
    }

    /** Array con uguaglianza per contenuto, usabile come chiave di un insieme */
    private static final class CanonicalClause {

        private final int[] literals;
        private final int hash;

        CanonicalClause(int[] literals) {
            this.literals = literals;
            this.hash = Arrays.hashCode(literals);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof CanonicalClause && Arrays.equals(literals, ((CanonicalClause) other).literals);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
