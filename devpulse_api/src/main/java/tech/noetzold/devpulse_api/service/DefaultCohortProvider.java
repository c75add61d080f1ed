package tech.noetzold.devpulse_api.service;

import tech.noetzold.devpulse_api.model.BurnoutAssessment;
import tech.noetzold.devpulse_api.model.DeveloperProfile;
import tech.noetzold.devpulse_api.model.TeamAnalytics;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.model.WellnessMetrics;

import java.util.List;
import java.util.Optional;

/**
 * Source of the deterministic data used in place of an upstream that failed or had nothing to say.
 */
public interface DefaultCohortProvider {

    List<TeamMember> defaultTeam(Optional<BurnoutAssessment> burnout);

    TeamAnalytics defaultAnalytics(String teamId);

    /**
     * Risk score for a member the team source listed without one.
     */
    double defaultRiskScore(Optional<BurnoutAssessment> burnout);

    DeveloperProfile defaultDeveloperProfile();

    WellnessMetrics defaultWellnessMetrics();
}
