package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    HIGH("high"),
    MODERATE("moderate"),
    LOW("low");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
