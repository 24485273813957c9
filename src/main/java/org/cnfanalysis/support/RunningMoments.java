package org.cnfanalysis.support;

/**
 * MOMENTI IN STREAMING - Media e deviazione standard di popolazione in un solo passaggio
 *
 * Implementa l'aggiornamento online di Welford nella variante pesata: ogni
 * osservazione può rappresentare più occorrenze dello stesso valore, così da
 * poter riassumere direttamente un istogramma di frequenze. La somma dei quadrati
 * degli scarti è accumulata incrementalmente, evitando la cancellazione numerica
 * della formula ingenua E[x²] - E[x]².
 */
public final class RunningMoments {

    private long count = 0;
    private double mean = 0.0;
    private double squaredDeviations = 0.0;
    private double sum = 0.0;
    private double smallest = Double.NaN;
    private double largest = Double.NaN;

    public void add(double value) {
        add(value, 1L);
    }

    /**
     * Registra {@code weight} occorrenze del valore.
     *
     * @param value valore osservato
     * @param weight numero di occorrenze, ignorato se non positivo
     */
    public void add(double value, long weight) {
        if (weight <= 0) {
            return;
        }

        count += weight;
        double delta = value - mean;
        mean += delta * weight / count;
        squaredDeviations += weight * delta * (value - mean);
        sum += value * weight;

        if (count == weight) {
            smallest = value;
            largest = value;
        } else {
            smallest = Math.min(smallest, value);
            largest = Math.max(largest, value);
        }
    }

    public long getCount() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * @return media aritmetica, 0 se nessuna osservazione
     */
    public double getMean() {
        return mean;
    }

    public double getSum() {
        return sum;
    }

    /**
     * @return varianza di popolazione (divisore n), 0 se nessuna osservazione
     */
    public double getPopulationVariance() {
        if (count == 0) {
            return 0.0;
        }
        // Errori di arrotondamento possono produrre valori appena negativi
        return Math.max(0.0, squaredDeviations / count);
    }

    public double getPopulationStandardDeviation() {
        return Math.sqrt(getPopulationVariance());
    }

    /**
     * @return minimo osservato, NaN se nessuna osservazione
     */
    public double getSmallest() {
        return smallest;
    }

    /**
     * @return massimo osservato, NaN se nessuna osservazione
     */
    public double getLargest() {
        return largest;
    }

    @Override
    public String toString() {
        return String.format("RunningMoments[n=%d, mean=%.4f, sd=%.4f]",
                count, mean, getPopulationStandardDeviation());
    }
}
