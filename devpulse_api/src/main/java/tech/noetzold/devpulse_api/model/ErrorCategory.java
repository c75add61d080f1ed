package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorCategory {
    RUNTIME("runtime"),
    NETWORK("network"),
    RENDERING("rendering"),
    NAVIGATION("navigation");

    private final String value;

    ErrorCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ErrorCategory fromValue(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase();
        for (ErrorCategory c : values()) {
            if (c.value.equals(v)) return c;
        }
        // unmapped values weigh as the table default
        return null;
    }
}
