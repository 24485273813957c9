package org.cnfanalysis.features;

import org.cnfanalysis.support.DistributionSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MAPPA DELLE METRICHE - Nome metrica → valore, nell'ordine di assemblaggio
 *
 * Contiene soltanto metriche (Long, Double o Boolean): timestamp, nome file e
 * hash appartengono al livello di output. Una volta costruita è immutabile.
 */
public final class FeatureMap {

    private final Map<String, Object> values;

    private FeatureMap(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    //region LETTURA

    /**
     * @return valore della metrica, null se assente
     */
    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException se la metrica è assente o non intera
     */
    public long getLong(String name) {
        return typed(name, Long.class);
    }

    /**
     * @throws IllegalArgumentException se la metrica è assente o non decimale
     */
    public double getDouble(String name) {
        return typed(name, Double.class);
    }

    /**
     * @throws IllegalArgumentException se la metrica è assente o non booleana
     */
    public boolean getBoolean(String name) {
        return typed(name, Boolean.class);
    }

    private <T> T typed(String name, Class<T> type) {
        Object value = values.get(name);
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Metrica '" + name + "' assente o non di tipo "
                    + type.getSimpleName() + ": " + value);
        }
        return type.cast(value);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * @return vista non modificabile, nell'ordine di assemblaggio
     */
    public Map<String, Object> asMap() {
        return values;
    }

    //endregion

    @Override
    public boolean equals(Object other) {
        return other instanceof FeatureMap && values.equals(((FeatureMap) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureMap" + values;
    }

    /**
     * Costruttore incrementale. Ogni aggregatore possiede chiavi disgiunte:
     * una chiave ripetuta indica un errore di programmazione.
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, long value) {
            return putValue(name, value);
        }

        public Builder put(String name, double value) {
            return putValue(name, value);
        }

        public Builder put(String name, boolean value) {
            return putValue(name, value);
        }

        public Builder putAll(Map<String, Long> counts) {
            counts.forEach((name, count) -> put(name, count.longValue()));
            return this;
        }

        /**
         * Emette le statistiche di una distribuzione con il prefisso indicato:
         * _count, _sum, _mean, _sd, _smallest, _largest e, se richiesti, _median ed _entropy.
         */
        public Builder putDistribution(String prefix, DistributionSummary summary,
                                       boolean withMedian, boolean withEntropy) {
            put(prefix + "_count", summary.count());
            put(prefix + "_sum", summary.sum());
            put(prefix + "_mean", summary.mean());
            put(prefix + "_sd", summary.standardDeviation());
            put(prefix + "_smallest", summary.smallest());
            put(prefix + "_largest", summary.largest());
            if (withMedian) {
                put(prefix + "_median", summary.median());
            }
            if (withEntropy) {
                put(prefix + "_entropy", summary.entropy());
            }
            return this;
        }

        private Builder putValue(String name, Object value) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Nome metrica vuoto");
            }
            if (values.putIfAbsent(name, value) != null) {
                throw new IllegalStateException("Metrica '" + name + "' emessa due volte");
            }
            return this;
        }

        public FeatureMap build() {
            return new FeatureMap(values);
        }
    }
}
