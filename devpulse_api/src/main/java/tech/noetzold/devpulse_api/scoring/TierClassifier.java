package tech.noetzold.devpulse_api.scoring;

public final class TierClassifier {

    private TierClassifier() {
    }

    public static <T> T classify(double score, ThresholdTable<T> table) {
        for (ThresholdTable.Threshold<T> threshold : table.thresholds()) {
            if (score >= threshold.minimum()) {
                return threshold.tier();
            }
        }
        return table.fallback();
    }
}
