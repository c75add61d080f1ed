package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEnvelope<T>(
        Boolean success,
        T data,
        ApiError error,
        String timestamp
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiError(String code, String message) {}

    public boolean isUsable() {
        return Boolean.TRUE.equals(success) && data != null;
    }
}
