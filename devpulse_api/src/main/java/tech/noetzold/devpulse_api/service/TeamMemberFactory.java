package tech.noetzold.devpulse_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.AlertType;
import tech.noetzold.devpulse_api.model.MemberAlert;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.scoring.RiskClassifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw member signals into a {@link TeamMember}: risk tier, wellness and stress factors, alerts and
 * recommendations all follow from the risk score.
 */
@Component
public class TeamMemberFactory {

    public record MemberSeed(
            String id,
            String name,
            String role,
            int capacity,
            double riskScore,
            MemberTrend trend,
            int velocity,
            Double wellnessFactor,     // null derives it from the risk score
            int collaborationHealth
    ) {}

    private final RiskClassifier riskClassifier;

    public TeamMemberFactory(RiskClassifier riskClassifier) {
        this.riskClassifier = riskClassifier;
    }

    public TeamMember create(MemberSeed seed, List<String> upstreamRecommendations) {
        double risk = seed.riskScore();
        return TeamMember.builder()
                .id(seed.id())
                .name(seed.name())
                .role(seed.role())
                .capacity(seed.capacity())
                .riskScore(risk)
                .burnoutRisk(riskClassifier.classify(risk))
                .trend(seed.trend() != null ? seed.trend() : MemberTrend.STABLE)
                .velocity(seed.velocity())
                .wellnessFactor(seed.wellnessFactor() != null ? seed.wellnessFactor() : wellnessFactor(risk))
                .collaborationHealth(seed.collaborationHealth())
                .stressMultiplier(stressMultiplier(risk))
                .alerts(alerts(risk))
                .recommendations(recommendations(risk, upstreamRecommendations))
                .build();
    }

    double wellnessFactor(double risk) {
        if (risk < 30) return 0.95;
        if (risk < 60) return 0.8;
        return 0.7;
    }

    double stressMultiplier(double risk) {
        if (risk > 70) return 1.3;
        if (risk > 40) return 1.1;
        return 0.9;
    }

    List<MemberAlert> alerts(double risk) {
        List<MemberAlert> alerts = new ArrayList<>();
        if (risk > 80) {
            alerts.add(new MemberAlert(AlertType.CRITICAL, "3 consecutive late-night sessions", "2h ago"));
        }
        if (risk > 60) {
            alerts.add(new MemberAlert(AlertType.WARNING, "Code quality declining (-15%)", "1d ago"));
        }
        if (risk < 30) {
            alerts.add(new MemberAlert(AlertType.INFO, "High mentoring activity - great impact!", "6h ago"));
        }
        return alerts;
    }

    List<String> recommendations(double risk, List<String> upstream) {
        if (upstream != null && !upstream.isEmpty()) {
            return upstream.subList(0, Math.min(3, upstream.size()));
        }
        if (risk > 70) {
            return List.of(
                    "Redistribute 2-3 tasks from backlog",
                    "Schedule wellness check-in",
                    "Pair with junior dev to reduce load");
        }
        if (risk > 40) {
            return List.of(
                    "Monitor workload closely",
                    "Encourage regular breaks",
                    "Consider pair programming");
        }
        return List.of(
                "Consider for tech lead opportunities",
                "Maintain current healthy patterns",
                "Could take on additional responsibilities");
    }
}
