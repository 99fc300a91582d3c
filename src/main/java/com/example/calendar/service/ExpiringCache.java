package com.example.calendar.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide key/value store with per-entry expiry. Expired entries are dropped on read.
 */
@Component
@RequiredArgsConstructor
public class ExpiringCache {

    private final Clock clock;

    private final Map<String, Entry> storage = new ConcurrentHashMap<>();

    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = storage.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            storage.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value())
                .filter(type::isInstance)
                .map(type::cast);
    }

    public void put(String key, Object value, Duration ttl) {
        storage.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    public void evict(String key) {
        storage.remove(key);
    }

    private record Entry(Object value, Instant expiresAt) {}
}
