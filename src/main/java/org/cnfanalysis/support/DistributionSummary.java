package org.cnfanalysis.support;

/**
 * Riepilogo esatto di una distribuzione di interi non negativi.
 *
 * @param count numero di osservazioni
 * @param sum somma dei valori osservati
 * @param mean media, calcolata come sum / count
 * @param standardDeviation deviazione standard di popolazione
 * @param smallest valore minimo
 * @param largest valore massimo
 * @param median mediana esatta (media dei due valori centrali per count pari)
 * @param entropy entropia di Shannon in bit delle frequenze normalizzate
 */
public record DistributionSummary(long count, long sum, double mean, double standardDeviation,
                                  long smallest, long largest, double median, double entropy) {
}
