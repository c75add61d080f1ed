package tech.noetzold.devpulse_api.model;

public record WellnessMetrics(
        int workLifeBalance,
        int codeQuality,
        int collaborationHealth,
        double stressLevel,
        MemberTrend productivityTrend
) {}
