package org.cnfanalysis.features;

import org.cnfanalysis.support.FrequencyHistogram;
import org.cnfanalysis.support.RunningMoments;

/**
 * DISTRIBUZIONI PER CLAUSOLA - Lunghezza, polarità e dispersione delle variabili
 *
 * Gli istogrammi sono indicizzati per lunghezza: la memoria cresce con le
 * lunghezze distinte, non con il numero di clausole.
 */
public final class ClauseLengthAggregator implements FeatureAggregator {

    private final FrequencyHistogram lengths = new FrequencyHistogram();
    private final FrequencyHistogram positivesPerClause = new FrequencyHistogram();
    private final FrequencyHistogram negativesPerClause = new FrequencyHistogram();

    // Frazione di positivi e deviazione standard delle variabili, solo su clausole non vuote
    private final RunningMoments polarityRatio = new RunningMoments();
    private final RunningMoments variableSpread = new RunningMoments();
    private double polarityRatioEntropy = 0.0;

    private long firstLength = -1;
    private boolean uniform = true;

    @Override
    public void accept(int[] clause, int length) {
        lengths.add(length);

        if (firstLength < 0) {
            firstLength = length;
        } else if (length != firstLength) {
            uniform = false;
        }

        if (length == 0) {
            positivesPerClause.add(0);
            negativesPerClause.add(0);
            return;
        }

        int positives = 0;
        RunningMoments variables = new RunningMoments();
        for (int i = 0; i < length; i++) {
            if (clause[i] > 0) {
                positives++;
            }
            variables.add(Math.abs((long) clause[i]));
        }
        int negatives = length - positives;

        positivesPerClause.add(positives);
        negativesPerClause.add(negatives);
        // 0 = nessun positivo, 1 = tutti positivi
        double ratio = (double) positives / length;
        polarityRatio.add(ratio);
        if (ratio > 0.0) {
            polarityRatioEntropy -= ratio * log2(ratio);
        }
        variableSpread.add(variables.getPopulationStandardDeviation());
    }

    @Override
    public void contributeTo(FeatureMap.Builder features) {
        if (!lengths.isEmpty()) {
            features.putDistribution("clauses_length", lengths.summarize(), true, false);
            features.putDistribution("positive_literals_in_clause", positivesPerClause.summarize(), false, false);
            features.putDistribution("negative_literals_in_clause", negativesPerClause.summarize(), false, false);
        }
        features.put("clauses_length_uniform", uniform);

        if (!polarityRatio.isEmpty()) {
            features.put("positive_negative_literals_in_clause_ratio_mean", polarityRatio.getMean())
                    .put("positive_negative_literals_in_clause_ratio_sd",
                            polarityRatio.getPopulationStandardDeviation())
                    .put("positive_negative_literals_in_clause_ratio_entropy", polarityRatioEntropy)
                    .put("clause_variables_sd_mean", variableSpread.getMean());
        }
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
