package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Severity fromValue(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase();
        for (Severity s : values()) {
            if (s.value.equals(v)) return s;
        }
        // unmapped values weigh as the table default
        return null;
    }
}
