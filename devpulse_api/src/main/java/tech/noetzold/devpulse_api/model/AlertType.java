package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    CRITICAL("critical"),
    WARNING("warning"),
    INFO("info");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
