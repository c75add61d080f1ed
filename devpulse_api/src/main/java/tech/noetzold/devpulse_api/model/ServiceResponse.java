package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope returned by the dashboard read paths. {@code data} and {@code error} are never both set.
 */
public record ServiceResponse<T>(
        T data,
        @JsonProperty("isLoading") boolean isLoading,
        String error
) {
    public static <T> ServiceResponse<T> success(T data) {
        return new ServiceResponse<>(data, false, null);
    }

    public static <T> ServiceResponse<T> failure(String error) {
        return new ServiceResponse<>(null, false, error);
    }

    public static <T> ServiceResponse<T> loading() {
        return new ServiceResponse<>(null, true, null);
    }
}
