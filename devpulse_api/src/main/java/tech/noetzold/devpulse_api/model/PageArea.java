package tech.noetzold.devpulse_api.model;

/**
 * Area of the application a URL belongs to. Order of the checks in {@link #fromUrl(String)} matters:
 * a path containing both "/dashboard" and "/api" is a dashboard page.
 */
public enum PageArea {
    DASHBOARD("dashboard"),
    AUTH("authentication"),
    API("API"),
    SETTINGS("settings"),
    PROFILE("profile"),
    GENERAL("general");

    private final String label;

    PageArea(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PageArea fromUrl(String url) {
        if (url == null) return GENERAL;
        if (url.contains("/dashboard")) return DASHBOARD;
        if (url.contains("/auth")) return AUTH;
        if (url.contains("/api")) return API;
        if (url.contains("/settings")) return SETTINGS;
        if (url.contains("/profile")) return PROFILE;
        return GENERAL;
    }
}
