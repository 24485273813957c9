package org.cnfanalysis.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ISTOGRAMMA DI FREQUENZE ESATTO - Valore osservato → numero di occorrenze
 *
 * Conserva l'intera distribuzione dei valori, non un campione: mediana ed entropia
 * risultano esatte. La memoria dipende dal numero di valori distinti, che per
 * lunghezze di clausola e conteggi di occorrenza resta piccolo anche su file enormi.
 *
 * I valori piccoli (caso dominante: lunghezze di clausola) sono contati in un
 * array denso senza boxing; i rimanenti in una mappa.
 */
public final class FrequencyHistogram {

    private static final int DENSE_LIMIT = 1024;
    private static final double LN_2 = Math.log(2.0);

    private final long[] dense = new long[DENSE_LIMIT];
    private final Map<Long, Long> sparse = new HashMap<>();
    private long count = 0;

    //region ACCUMULO

    public void add(long value) {
        add(value, 1L);
    }

    /**
     * @param value valore osservato, non negativo
     * @param times numero di occorrenze da registrare
     */
    public void add(long value, long times) {
        if (value < 0) {
            throw new IllegalArgumentException("Valore negativo non ammesso nell'istogramma: " + value);
        }
        if (times <= 0) {
            return;
        }

        if (value < DENSE_LIMIT) {
            dense[(int) value] += times;
        } else {
            sparse.merge(value, times, Long::sum);
        }
        count += times;
    }

    public long getCount() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @return numero di valori distinti osservati
     */
    public int distinctValues() {
        int distinct = sparse.size();
        for (long frequency : dense) {
            if (frequency > 0) {
                distinct++;
            }
        }
        return distinct;
    }

    //endregion

    //region RIEPILOGO

    /**
     * Calcola il riepilogo della distribuzione. Non modifica lo stato.
     *
     * @return riepilogo con momenti, estremi, mediana ed entropia
     * @throws IllegalStateException se l'istogramma è vuoto
     */
    public DistributionSummary summarize() {
        if (count == 0) {
            throw new IllegalStateException("Istogramma vuoto: nessun riepilogo disponibile");
        }

        List<long[]> buckets = sortedBuckets();
        RunningMoments moments = new RunningMoments();
        long sum = 0;
        double entropyBits = 0.0;

        for (long[] bucket : buckets) {
            long value = bucket[0];
            long frequency = bucket[1];
            moments.add(value, frequency);
            sum += value * frequency;

            double probability = (double) frequency / count;
            entropyBits -= probability * Math.log(probability) / LN_2;
        }

        long smallest = buckets.get(0)[0];
        long largest = buckets.get(buckets.size() - 1)[0];

        return new DistributionSummary(count, sum, (double) sum / count,
                moments.getPopulationStandardDeviation(), smallest, largest,
                median(buckets), entropyBits);
    }

    /**
     * Mediana esatta: valore centrale per count dispari, media dei due centrali per count pari.
     */
    private double median(List<long[]> buckets) {
        long lowerRank = (count - 1) / 2;   // rango 0-based del centrale inferiore
        long upperRank = count / 2;         // coincide con lowerRank se count è dispari

        long lower = -1;
        long cumulative = 0;
        for (long[] bucket : buckets) {
            cumulative += bucket[1];
            if (lower < 0 && cumulative > lowerRank) {
                lower = bucket[0];
            }
            if (cumulative > upperRank) {
                return (lower + bucket[0]) / 2.0;
            }
        }
        throw new IllegalStateException("Istogramma incoerente: conteggio " + count);
    }

    /**
     * @return coppie (valore, frequenza) in ordine crescente di valore
     */
    private List<long[]> sortedBuckets() {
        List<long[]> buckets = new ArrayList<>();
        for (int value = 0; value < DENSE_LIMIT; value++) {
            if (dense[value] > 0) {
                buckets.add(new long[]{value, dense[value]});
            }
        }

        // Tutte le chiavi sparse sono >= DENSE_LIMIT: l'ordine complessivo resta crescente
        sparse.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> buckets.add(new long[]{entry.getKey(), entry.getValue()}));
        return buckets;
    }

    //endregion
}
