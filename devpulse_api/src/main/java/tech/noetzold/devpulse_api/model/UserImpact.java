package tech.noetzold.devpulse_api.model;

import java.util.List;

public record UserImpact(
        ImpactSeverity severity,
        List<String> affectedUserRoles,
        List<String> affectedFeatures,
        String businessImpact,
        String userExperienceImpact,
        int estimatedAffectedUsers
) {}
