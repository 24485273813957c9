package org.cnfanalysis.features;

import java.util.Arrays;

/**
 * CONTEGGI PER CLAUSOLA - Totali e classificazioni che dipendono dalla sola clausola corrente
 *
 * Metriche: clauses_count, literals_count, positive/negative_literals_count,
 * positive_literals_ratio, unitarie, binarie, definite, goal e tautologiche.
 */
public final class ClauseCountingAggregator implements FeatureAggregator {

    private long clauses = 0;
    private long literals = 0;
    private long positiveLiterals = 0;
    private long negativeLiterals = 0;
    private long positiveUnitClauses = 0;
    private long negativeUnitClauses = 0;
    private long twoLiteralClauses = 0;
    private long definiteClauses = 0;
    private long goalClauses = 0;
    private long tautologicalClauses = 0;
    private long tautologicalLiterals = 0;

    // Chiavi (variabile << 1 | polarità) della clausola corrente, ordinate per il controllo tautologico
    private long[] scratch = new long[16];

    @Override
    public void accept(int[] clause, int length) {
        clauses++;
        literals += length;

        int positives = 0;
        for (int i = 0; i < length; i++) {
            if (clause[i] > 0) {
                positives++;
            }
        }
        int negatives = length - positives;
        positiveLiterals += positives;
        negativeLiterals += negatives;

        if (length == 1) {
            if (positives == 1) {
                positiveUnitClauses++;
            } else {
                negativeUnitClauses++;
            }
        } else if (length == 2) {
            twoLiteralClauses++;
        }

        if (positives == 1) {
            definiteClauses++;
        } else if (positives == 0 && length > 0) {
            goalClauses++;
        }

        int complementary = complementaryVariables(clause, length);
        if (complementary > 0) {
            tautologicalClauses++;
            tautologicalLiterals += complementary;
        }
    }

    /**
     * @return numero di variabili che compaiono nella clausola con entrambe le polarità
     */
    private int complementaryVariables(int[] clause, int length) {
        if (length < 2) {
            return 0;
        }
        if (scratch.length < length) {
            scratch = new long[Math.max(length, scratch.length * 2)];
        }
        for (int i = 0; i < length; i++) {
            long variable = Math.abs((long) clause[i]);
            scratch[i] = (variable << 1) | (clause[i] < 0 ? 1L : 0L);
        }
        Arrays.sort(scratch, 0, length);

        int complementary = 0;
        int i = 0;
        while (i < length) {
            long variable = scratch[i] >>> 1;
            boolean positive = false;
            boolean negative = false;
            while (i < length && (scratch[i] >>> 1) == variable) {
                if ((scratch[i] & 1L) == 0) {
                    positive = true;
                } else {
                    negative = true;
                }
                i++;
            }
            if (positive && negative) {
                complementary++;
            }
        }
        return complementary;
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        features.put("clauses_count", clauses)
                .put("literals_count", literals)
                .put("positive_literals_count", positiveLiterals)
                .put("negative_literals_count", negativeLiterals);
        if (literals > 0) {
            features.put("positive_literals_ratio", (double) positiveLiterals / literals);
        }
        features.put("positive_unit_clause_count", positiveUnitClauses)
                .put("negative_unit_clause_count", negativeUnitClauses)
                .put("two_literals_clause_count", twoLiteralClauses)
                .put("definite_clauses_count", definiteClauses)
                .put("goal_clauses_count", goalClauses)
                .put("tautological_clauses_count", tautologicalClauses)
                .put("tautological_literals_count", tautologicalLiterals);
    }
}
