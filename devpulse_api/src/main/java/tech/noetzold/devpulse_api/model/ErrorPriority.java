package tech.noetzold.devpulse_api.model;

import java.util.List;

public record ErrorPriority(
        PriorityLevel level,
        String reasoning,
        int score,
        List<PriorityFactor> factors
) {}
