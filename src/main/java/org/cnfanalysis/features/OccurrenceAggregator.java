package org.cnfanalysis.features;

import org.cnfanalysis.support.DenseIndex;
import org.cnfanalysis.support.FrequencyHistogram;
import org.cnfanalysis.support.PercentileBuckets;

import java.util.Arrays;

/**
 * OCCORRENZE DI VARIABILI E LETTERALI - Conteggi per polarità, decisi alla finalizzazione
 *
 * Per ogni variabile osservata si tengono le occorrenze positive e negative in
 * array indicizzati dalla posizione densa della variabile. Purezza, distribuzioni
 * di occorrenza e fasce percentuali si calcolano soltanto in {@link #contributeTo},
 * quando i conteggi sono definitivi.
 *
 * Una variabile mai osservata non ha letterali: non conta né come usata né come pura.
 */
public final class OccurrenceAggregator implements FeatureAggregator {

    private static final int INITIAL_CAPACITY = 64;

    private final DenseIndex variables = new DenseIndex();
    private long[] positive = new long[INITIAL_CAPACITY];
    private long[] negative = new long[INITIAL_CAPACITY];

    @Override
    public void accept(int[] clause, int length) {
        for (int i = 0; i < length; i++) {
            int literal = clause[i];
            int slot = variables.slotOf(Math.abs(literal));
            if (slot == positive.length) {
                positive = Arrays.copyOf(positive, positive.length * 2);
                negative = Arrays.copyOf(negative, negative.length * 2);
            }
            if (literal > 0) {
                positive[slot]++;
            } else {
                negative[slot]++;
            }
        }
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        int used = variables.size();

        FrequencyHistogram variableOccurrences = new FrequencyHistogram();
        FrequencyHistogram literalOccurrences = new FrequencyHistogram();
        long usedLiterals = 0;
        long purePositive = 0;
        long pureNegative = 0;
        long existential = 0;
        long existentialPositive = 0;
        long occurringOnce = 0;
        long maxVariableOccurrence = 0;
        long maxLiteralOccurrence = 0;
        int largest = 0;
        int smallest = Integer.MAX_VALUE;

        for (int slot = 0; slot < used; slot++) {
            long pos = positive[slot];
            long neg = negative[slot];
            int variable = variables.keyAt(slot);
            largest = Math.max(largest, variable);
            smallest = Math.min(smallest, variable);

            variableOccurrences.add(pos + neg);
            maxVariableOccurrence = Math.max(maxVariableOccurrence, pos + neg);

            if (pos > 0) {
                usedLiterals++;
                literalOccurrences.add(pos);
                maxLiteralOccurrence = Math.max(maxLiteralOccurrence, pos);
                if (pos == 1) {
                    occurringOnce++;
                }
            }
            if (neg > 0) {
                usedLiterals++;
                literalOccurrences.add(neg);
                maxLiteralOccurrence = Math.max(maxLiteralOccurrence, neg);
                if (neg == 1) {
                    occurringOnce++;
                }
            }

            if (neg == 0) {
                purePositive++;
                if (pos == 1) {
                    existential++;
                    existentialPositive++;
                }
            } else if (pos == 0) {
                pureNegative++;
                if (neg == 1) {
                    existential++;
                }
            }
        }

        features.put("variables_used_count", (long) used)
                .put("literals_used_count", usedLiterals)
                .put("pure_literals_count", purePositive + pureNegative)
                .put("pure_positive_literals_count", purePositive)
                .put("pure_negative_literals_count", pureNegative)
                .put("existential_literals_count", existential)
                .put("existential_positive_literals_count", existentialPositive)
                .put("literals_occurence_one_count", occurringOnce);

        if (used == 0) {
            return;
        }

        features.put("variables_largest", (long) largest)
                .put("variables_smallest", (long) smallest)
                .putDistribution("variables_occurrence", variableOccurrences.summarize(), true, true)
                .putDistribution("literals_occurrence", literalOccurrences.summarize(), true, true)
                .putAll(variableBuckets(used, maxVariableOccurrence).nonEmptyBuckets("variables_frequency"))
                .putAll(literalBuckets(used, maxLiteralOccurrence).nonEmptyBuckets("literals_frequency"));
    }

    private PercentileBuckets variableBuckets(int used, long maximum) {
        PercentileBuckets buckets = new PercentileBuckets();
        for (int slot = 0; slot < used; slot++) {
            buckets.add(positive[slot] + negative[slot], maximum);
        }
        return buckets;
    }

    private PercentileBuckets literalBuckets(int used, long maximum) {
        PercentileBuckets buckets = new PercentileBuckets();
        for (int slot = 0; slot < used; slot++) {
            if (positive[slot] > 0) {
                buckets.add(positive[slot], maximum);
            }
            if (negative[slot] > 0) {
                buckets.add(negative[slot], maximum);
            }
        }
        return buckets;
    }
}
