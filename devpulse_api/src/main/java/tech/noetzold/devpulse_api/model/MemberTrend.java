package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberTrend {
    IMPROVING("improving"),
    STABLE("stable"),
    DECLINING("declining");

    private final String value;

    MemberTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
