package tech.noetzold.devpulse_api.repository.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import tech.noetzold.devpulse_api.model.CacheEntry;
import tech.noetzold.devpulse_api.repository.TtlCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Repository
public class InMemoryTtlCache implements TtlCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTtlCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (!entry.isValidAt(now)) {
            // only drop the entry we saw; a concurrent put may already have replaced it
            entries.remove(key, entry);
            log.debug("Cache entry {} expired after {}", key, entry.ttl());
            return Optional.empty();
        }

        if (!type.isInstance(entry.payload())) {
            log.warn("Cache entry {} holds {} but {} was requested", key,
                    entry.payload().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.payload()));
    }

    @Override
    public void put(String key, Object payload, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        entries.put(key, new CacheEntry(key, payload, clock.instant(), ttl));
    }

    @Override
    public void invalidate(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    @Override
    public void invalidateAll() {
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
