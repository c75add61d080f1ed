package tech.noetzold.devpulse_api.model;

/**
 * Single-developer view. {@code assessment} is null when the burnout source had nothing usable.
 */
public record WellnessDashboard(
        BurnoutAssessment assessment,
        DeveloperProfile developerProfile,
        WellnessMetrics wellnessMetrics
) {}
