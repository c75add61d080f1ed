package tech.noetzold.devpulse_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;
import tech.noetzold.devpulse_api.model.DeveloperProfile;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.RiskLevel;
import tech.noetzold.devpulse_api.model.TeamAnalytics;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.model.WellnessMetrics;
import tech.noetzold.devpulse_api.service.TeamMemberFactory.MemberSeed;

import java.util.List;
import java.util.Optional;

@Component
public class FixedDefaultCohortProvider implements DefaultCohortProvider {

    static final double LEAD_MEMBER_RISK = 75;
    static final double UNKNOWN_MEMBER_RISK = 50;

    static final DeveloperProfile DEFAULT_PROFILE = new DeveloperProfile("Developer", 12, 78, RiskLevel.MODERATE);
    static final WellnessMetrics DEFAULT_METRICS = new WellnessMetrics(72, 88, 81, 34, MemberTrend.STABLE);

    private final TeamMemberFactory memberFactory;

    public FixedDefaultCohortProvider(TeamMemberFactory memberFactory) {
        this.memberFactory = memberFactory;
    }

    @Override
    public List<TeamMember> defaultTeam(Optional<BurnoutAssessment> burnout) {
        double leadRisk = burnout.map(BurnoutAssessment::riskScore).orElse(LEAD_MEMBER_RISK);
        List<String> upstreamRecs = burnout.map(BurnoutAssessment::recommendations).orElse(List.of());

        List<MemberSeed> seeds = List.of(
                new MemberSeed("1", "Sarah Chen", "Senior Frontend", 92, leadRisk, MemberTrend.DECLINING, 84, null, 78),
                new MemberSeed("2", "Marcus Rodriguez", "Full Stack", 78, 45, MemberTrend.STABLE, 91, null, 88),
                new MemberSeed("3", "Priya Patel", "Backend Lead", 65, 25, MemberTrend.IMPROVING, 76, null, 93),
                new MemberSeed("4", "Alex Kim", "Junior Developer", 88, 55, MemberTrend.STABLE, 72, null, 81)
        );

        return seeds.stream()
                .map(seed -> memberFactory.create(seed, upstreamRecs))
                .toList();
    }

    @Override
    public TeamAnalytics defaultAnalytics(String teamId) {
        return new TeamAnalytics(
                teamId != null ? teamId : "default",
                new TeamAnalytics.VelocityMetrics(8.5, "increasing", 12.3),
                new TeamAnalytics.CollaborationMetrics(0.75, List.of())
        );
    }

    @Override
    public double defaultRiskScore(Optional<BurnoutAssessment> burnout) {
        return burnout.map(BurnoutAssessment::riskScore).orElse(UNKNOWN_MEMBER_RISK);
    }

    @Override
    public DeveloperProfile defaultDeveloperProfile() {
        return DEFAULT_PROFILE;
    }

    @Override
    public WellnessMetrics defaultWellnessMetrics() {
        return DEFAULT_METRICS;
    }
}
