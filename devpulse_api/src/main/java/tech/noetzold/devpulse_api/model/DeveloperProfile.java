package tech.noetzold.devpulse_api.model;

public record DeveloperProfile(
        String name,
        int currentStreak,
        int wellnessScore,        // 100 minus the burnout risk score
        RiskLevel riskLevel
) {}
