package tech.noetzold.devpulse_api.model;

import java.util.List;

public record TeamAnalytics(
        String teamId,
        VelocityMetrics velocity,
        CollaborationMetrics collaboration
) {
    public record VelocityMetrics(double average, String trend, double percentageChange) {}

    public record CollaborationMetrics(double score, List<Bottleneck> bottlenecks) {}

    public record Bottleneck(String memberId, String reason) {}
}
