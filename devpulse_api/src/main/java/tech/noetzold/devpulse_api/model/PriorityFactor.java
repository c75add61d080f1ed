package tech.noetzold.devpulse_api.model;

public record PriorityFactor(
        String factor,
        int weight,
        String description
) {}
