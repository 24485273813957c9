package org.cnfanalysis.support;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ripartizione in 20 fasce da 5 punti percentuali di valori normalizzati
 * rispetto a un massimo. Un rapporto pari a 1 ricade nell'ultima fascia (95-100).
 */
public final class PercentileBuckets {

    public static final int BUCKET_COUNT = 20;
    public static final int BUCKET_WIDTH = 100 / BUCKET_COUNT;

    private final long[] occupancy = new long[BUCKET_COUNT];

    /**
     * @param value valore da classificare, tra 0 e {@code maximum}
     * @param maximum valore di normalizzazione, positivo
     */
    public void add(long value, long maximum) {
        if (maximum <= 0) {
            throw new IllegalArgumentException("Il massimo di normalizzazione deve essere positivo: " + maximum);
        }
        occupancy[bucketOf(value, maximum)]++;
    }

    static int bucketOf(long value, long maximum) {
        int bucket = (int) (value * BUCKET_COUNT / maximum);
        return Math.min(Math.max(bucket, 0), BUCKET_COUNT - 1);
    }

    public long getOccupancy(int bucket) {
        return occupancy[bucket];
    }

    /**
     * @param prefix prefisso del nome metrica
     * @return fasce non vuote nella forma {@code <prefix>_<da>_to_<a>} → occupazione
     */
    public Map<String, Long> nonEmptyBuckets(String prefix) {
        Map<String, Long> buckets = new LinkedHashMap<>();
        for (int i = 0; i < BUCKET_COUNT; i++) {
            if (occupancy[i] > 0) {
                buckets.put(prefix + "_" + (i * BUCKET_WIDTH) + "_to_" + ((i + 1) * BUCKET_WIDTH), occupancy[i]);
            }
        }
        return buckets;
    }
}
