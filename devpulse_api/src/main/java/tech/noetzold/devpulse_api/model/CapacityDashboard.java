package tech.noetzold.devpulse_api.model;

import java.util.List;

public record CapacityDashboard(
        List<TeamMember> teamMembers,
        TeamOverview teamOverview,
        TeamAnalytics teamAnalytics,
        List<CapacityBucket> capacityDistribution
) {}
