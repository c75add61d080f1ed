package tech.noetzold.devpulse_api.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store whose entries expire after their own time-to-live. Expired entries read as absent.
 */
public interface TtlCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object payload, Duration ttl);

    void invalidate(String key);

    void invalidateAll();

    int size();
}
