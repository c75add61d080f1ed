package tech.noetzold.devpulse_api.scoring;

import tech.noetzold.devpulse_api.model.PriorityFactor;

import java.util.List;

public record FactorScore(
        int totalScore,
        List<PriorityFactor> breakdown
) {
    public FactorScore {
        breakdown = List.copyOf(breakdown);
    }
}
