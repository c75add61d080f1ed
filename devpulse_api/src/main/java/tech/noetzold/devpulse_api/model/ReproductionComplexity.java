package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReproductionComplexity {
    SIMPLE("simple"),
    MODERATE("moderate"),
    COMPLEX("complex");

    private final String value;

    ReproductionComplexity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
