package tech.noetzold.devpulse_api.model;

public record TeamOverview(
        int averageCapacity,
        int highRiskCount,
        int optimalCount,
        int needsSupportCount,
        int totalVelocity,
        int teamMorale,
        int burnoutPrevented,
        int interventionsThisMonth
) {}
