package tech.noetzold.devpulse_api.model;

public record HealthStatus(
        boolean teamAnalytics,
        boolean burnout,
        boolean overall
) {
    public static HealthStatus down() {
        return new HealthStatus(false, false, false);
    }
}
