package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of a successful {@code /api/analytics/productivity} response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductivityReport(
        Metrics metrics,
        WorkPatterns workPatterns
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metrics(
            Integer commitCount,
            Integer prCount,
            List<Object> commitFrequency    // entries are only counted
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkPatterns(
            String averageStartTime,
            String averageEndTime,
            Double weekendWorkPercentage,
            Double consistencyScore
    ) {}
}
