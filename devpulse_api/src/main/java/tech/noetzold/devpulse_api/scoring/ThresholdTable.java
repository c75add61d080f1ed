package tech.noetzold.devpulse_api.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered (minimum score, tier) pairs, strictly descending by minimum, closed by a catch-all tier.
 */
public final class ThresholdTable<T> {

    public record Threshold<T>(double minimum, T tier) {}

    private final List<Threshold<T>> thresholds;
    private final T fallback;

    private ThresholdTable(List<Threshold<T>> thresholds, T fallback) {
        this.thresholds = List.copyOf(thresholds);
        this.fallback = fallback;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public List<Threshold<T>> thresholds() {
        return thresholds;
    }

    public T fallback() {
        return fallback;
    }

    public static final class Builder<T> {
        private final List<Threshold<T>> thresholds = new ArrayList<>();

        private Builder() {
        }

        public Builder<T> atLeast(double minimum, T tier) {
            Objects.requireNonNull(tier, "tier");
            if (!thresholds.isEmpty() && thresholds.get(thresholds.size() - 1).minimum() <= minimum) {
                throw new IllegalArgumentException("Thresholds must be strictly descending, got " + minimum
                        + " after " + thresholds.get(thresholds.size() - 1).minimum());
            }
            thresholds.add(new Threshold<>(minimum, tier));
            return this;
        }

        public ThresholdTable<T> otherwise(T fallback) {
            return new ThresholdTable<>(thresholds, Objects.requireNonNull(fallback, "fallback"));
        }
    }
}
