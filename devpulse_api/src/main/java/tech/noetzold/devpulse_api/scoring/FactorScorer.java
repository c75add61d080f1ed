package tech.noetzold.devpulse_api.scoring;

import tech.noetzold.devpulse_api.model.PriorityFactor;

import java.util.ArrayList;
import java.util.List;

/**
 * Sums the weights of every factor of an entity. Unmapped values take the table default, so scoring never fails.
 *
 * @param <E> entity kind being scored
 */
public final class FactorScorer<E> {

    private final List<WeightedFactor<E, ?>> factors;

    public FactorScorer(List<WeightedFactor<E, ?>> factors) {
        this.factors = List.copyOf(factors);
    }

    public FactorScore score(E entity) {
        List<PriorityFactor> breakdown = new ArrayList<>(factors.size());
        int total = 0;
        for (WeightedFactor<E, ?> factor : factors) {
            PriorityFactor item = itemize(factor, entity);
            breakdown.add(item);
            total += item.weight();
        }
        return new FactorScore(total, breakdown);
    }

    private static <E, V> PriorityFactor itemize(WeightedFactor<E, V> factor, E entity) {
        V value = factor.attribute().apply(entity);
        int weight = factor.table().weightOf(value);
        return new PriorityFactor(factor.table().factorName(), weight, factor.justification().apply(value));
    }
}
