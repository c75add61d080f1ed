package tech.noetzold.devpulse_api.model;

public enum UpstreamErrorCode {
    UNAUTHORIZED("You are not authorized to view this data. Please sign in again."),
    FORBIDDEN("You do not have permission to access this dashboard."),
    RATE_LIMITED("Too many requests. Please wait a moment and try again."),
    SERVICE_UNAVAILABLE("Dashboard service is temporarily unavailable. Please try again later."),
    NETWORK_ERROR("Network connection error. Please check your internet connection.");

    private final String userMessage;

    UpstreamErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }

    public static UpstreamErrorCode fromCode(String code) {
        if (code == null) return null;
        for (UpstreamErrorCode c : values()) {
            if (c.name().equalsIgnoreCase(code.trim())) return c;
        }
        return null;
    }
}
