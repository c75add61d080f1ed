package tech.noetzold.devpulse_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.TeamAnalytics;
import tech.noetzold.devpulse_api.model.TeamAnalyticsPayload;
import tech.noetzold.devpulse_api.model.TeamAnalyticsPayload.CollaborationNode;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.service.TeamMemberFactory.MemberSeed;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps upstream team analytics onto dashboard members and analytics, filling every gap from the
 * {@link DefaultCohortProvider}.
 */
@Component
public class TeamCohortAdapter {

    private static final List<String> ROLES = List.of(
            "Senior Frontend",
            "Full Stack",
            "Backend Lead",
            "Junior Developer",
            "DevOps Engineer",
            "QA Engineer"
    );

    static final int DEFAULT_CAPACITY = 80;
    static final int DEFAULT_VELOCITY = 85;
    static final int DEFAULT_COLLABORATION_HEALTH = 85;

    private final TeamMemberFactory memberFactory;
    private final DefaultCohortProvider defaults;

    public TeamCohortAdapter(TeamMemberFactory memberFactory, DefaultCohortProvider defaults) {
        this.memberFactory = memberFactory;
        this.defaults = defaults;
    }

    public List<TeamMember> toMembers(Optional<TeamAnalyticsPayload> team, Optional<BurnoutAssessment> burnout) {
        List<CollaborationNode> nodes = team.map(TeamAnalyticsPayload::nodes).orElse(List.<CollaborationNode>of())
                .stream()
                .filter(Objects::nonNull)
                .toList();
        if (nodes.isEmpty()) {
            return defaults.defaultTeam(burnout);
        }

        double fallbackRisk = defaults.defaultRiskScore(burnout);
        List<String> upstreamRecs = burnout.map(BurnoutAssessment::recommendations).orElse(List.of());

        List<TeamMember> members = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            CollaborationNode node = nodes.get(i);
            MemberSeed seed = new MemberSeed(
                    node.id() != null ? node.id() : String.valueOf(i + 1),
                    node.name() != null ? node.name() : "Member " + (i + 1),
                    node.role() != null ? node.role() : ROLES.get(i % ROLES.size()),
                    node.capacity() != null ? node.capacity() : DEFAULT_CAPACITY,
                    node.riskScore() != null ? node.riskScore() : fallbackRisk,
                    MemberTrend.STABLE,
                    node.velocity() != null ? node.velocity() : DEFAULT_VELOCITY,
                    node.wellnessFactor(),
                    node.collaborationHealth() != null ? node.collaborationHealth() : DEFAULT_COLLABORATION_HEALTH
            );
            members.add(memberFactory.create(seed, upstreamRecs));
        }
        return members;
    }

    public TeamAnalytics toAnalytics(Optional<TeamAnalyticsPayload> team, String requestedTeamId) {
        TeamAnalytics fallback = defaults.defaultAnalytics(requestedTeamId);
        if (team.isEmpty()) {
            return fallback;
        }

        TeamAnalyticsPayload payload = team.get();
        TeamAnalyticsPayload.Metrics metrics = payload.metrics();
        TeamAnalyticsPayload.Velocity v = metrics != null ? metrics.velocity() : null;
        TeamAnalyticsPayload.Collaboration c = metrics != null ? metrics.collaboration() : null;

        TeamAnalytics.VelocityMetrics fv = fallback.velocity();
        TeamAnalytics.CollaborationMetrics fc = fallback.collaboration();

        return new TeamAnalytics(
                payload.teamId() != null ? payload.teamId() : fallback.teamId(),
                new TeamAnalytics.VelocityMetrics(
                        v != null && v.average() != null ? v.average() : fv.average(),
                        v != null && v.trend() != null ? v.trend() : fv.trend(),
                        v != null && v.percentageChange() != null ? v.percentageChange() : fv.percentageChange()),
                new TeamAnalytics.CollaborationMetrics(
                        c != null && c.score() != null ? c.score() : fc.score(),
                        c != null && c.bottlenecks() != null ? List.copyOf(c.bottlenecks()) : fc.bottlenecks())
        );
    }
}
