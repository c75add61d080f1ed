package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of a successful {@code /api/analytics/team} response. Every field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TeamAnalyticsPayload(
        String teamId,
        Metrics metrics
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metrics(Velocity velocity, Collaboration collaboration) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Velocity(Double average, String trend, Double percentageChange) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Collaboration(Double score, List<TeamAnalytics.Bottleneck> bottlenecks, Network network) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Network(List<CollaborationNode> nodes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CollaborationNode(
            String id,
            String name,
            String role,
            Integer capacity,
            Integer velocity,
            Double wellnessFactor,
            Integer collaborationHealth,
            Double riskScore
    ) {}

    public List<CollaborationNode> nodes() {
        if (metrics == null || metrics.collaboration() == null || metrics.collaboration().network() == null) {
            return List.of();
        }
        List<CollaborationNode> nodes = metrics.collaboration().network().nodes();
        return nodes == null ? List.of() : nodes;
    }
}
