package tech.noetzold.devpulse_api.model;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(
        String key,
        Object payload,
        Instant timestamp,
        Duration ttl
) {
    public boolean isValidAt(Instant now) {
        return Duration.between(timestamp, now).compareTo(ttl) < 0;
    }
}
