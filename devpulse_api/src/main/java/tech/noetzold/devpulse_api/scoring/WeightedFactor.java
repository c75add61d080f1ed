package tech.noetzold.devpulse_api.scoring;

import java.util.function.Function;

/**
 * Binds a weight table to the attribute of {@code E} it scores and to the sentence that explains the weight.
 */
public record WeightedFactor<E, V>(
        FactorWeightTable<V> table,
        Function<E, V> attribute,
        Function<V, String> justification
) {
    public static <E, V> WeightedFactor<E, V> of(FactorWeightTable<V> table,
                                                 Function<E, V> attribute,
                                                 Function<V, String> justification) {
        return new WeightedFactor<>(table, attribute, justification);
    }
}
