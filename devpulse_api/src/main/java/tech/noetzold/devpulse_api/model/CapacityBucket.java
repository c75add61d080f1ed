package tech.noetzold.devpulse_api.model;

public record CapacityBucket(
        String range,
        int count,
        String color,
        String label
) {}
