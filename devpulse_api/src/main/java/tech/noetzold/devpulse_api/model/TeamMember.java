package tech.noetzold.devpulse_api.model;

import lombok.Builder;

import java.util.List;

@Builder
public record TeamMember(
        String id,
        String name,
        String role,
        int capacity,             // percent of nominal load, may exceed 100
        double riskScore,         // upstream burnout assessment, 0-100
        RiskLevel burnoutRisk,
        MemberTrend trend,
        int velocity,
        double wellnessFactor,    // 0-1
        int collaborationHealth,
        double stressMultiplier,
        List<MemberAlert> alerts,
        List<String> recommendations
) {
    public TeamMember {
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
