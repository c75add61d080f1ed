package tech.noetzold.devpulse_api.model;

public record MemberAlert(
        AlertType type,
        String message,
        String time
) {}
