package tech.noetzold.devpulse_api.scoring;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable lookup of factor value to weight, with a default for values the table does not map.
 *
 * @param <V> type of the factor value
 */
public final class FactorWeightTable<V> {

    private final String factorName;
    private final Map<V, Integer> weights;
    private final int defaultWeight;

    private FactorWeightTable(String factorName, Map<V, Integer> weights, int defaultWeight) {
        this.factorName = Objects.requireNonNull(factorName, "factorName");
        this.weights = Map.copyOf(weights);
        this.defaultWeight = defaultWeight;
    }

    public static <V> FactorWeightTable<V> of(String factorName, Map<V, Integer> weights, int defaultWeight) {
        if (defaultWeight < 0) {
            throw new IllegalArgumentException("Default weight for " + factorName + " must be non-negative");
        }
        for (Map.Entry<V, Integer> e : weights.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Weight for " + factorName + "=" + e.getKey() + " must be non-negative");
            }
        }
        return new FactorWeightTable<>(factorName, weights, defaultWeight);
    }

    public String factorName() {
        return factorName;
    }

    public int defaultWeight() {
        return defaultWeight;
    }

    public int weightOf(V value) {
        if (value == null) return defaultWeight;
        return weights.getOrDefault(value, defaultWeight);
    }

    public boolean isMapped(V value) {
        return value != null && weights.containsKey(value);
    }
}
