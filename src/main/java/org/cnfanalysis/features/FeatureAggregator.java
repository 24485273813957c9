package org.cnfanalysis.features;

/**
 * AGGREGATORE DI METRICHE - Accumulatore indipendente alimentato clausola per clausola
 *
 * Ogni aggregatore riceve tutte le clausole del file, mantiene uno stato
 * proporzionale alle entità distinte che osserva e possiede un insieme di chiavi
 * disgiunto da quello degli altri aggregatori.
 *
 * CONTRATTO:
 * - {@link #accept} non fallisce mai su clausole ben formate
 * - {@link #contributeTo} è di sola lettura e idempotente: chiamate ripetute
 *   producono le stesse metriche
 */
public interface FeatureAggregator {

    /**
     * @param literals buffer del parser, valido solo durante la chiamata
     * @param length numero di letterali della clausola (0 per la clausola vuota)
     */
    void accept(int[] literals, int length);

    /**
     * Trasforma lo stato accumulato nelle metriche possedute dall'aggregatore.
     *
     * @param features mappa in costruzione
     */
    void contributeTo(FeatureMap.Builder features);
}
