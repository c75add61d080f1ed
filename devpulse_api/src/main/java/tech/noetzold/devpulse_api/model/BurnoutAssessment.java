package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BurnoutAssessment(
        String userId,
        Double riskScore,          // 0-100
        Double confidence,         // 0-1
        List<String> recommendations,
        List<KeyFactor> keyFactors,
        List<TrendPoint> historicalTrend
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record KeyFactor(String name, Double impact, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrendPoint(String date, Double value) {}

    public BurnoutAssessment {
        recommendations = recommendations == null ? List.of() : recommendations;
        keyFactors = keyFactors == null ? List.of() : keyFactors;
        historicalTrend = historicalTrend == null ? List.of() : historicalTrend;
    }
}
