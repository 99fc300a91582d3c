package com.example.calendar.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class ExpiringCacheTest {

    private static final Instant T0 = Instant.parse("2025-06-15T12:00:00Z");

    private Clock clock;
    private ExpiringCache cache;

    @BeforeEach
    void setUp() {
        clock = Mockito.mock(Clock.class);
        when(clock.instant()).thenReturn(T0);
        cache = new ExpiringCache(clock);
    }

    @Test
    void shouldReturnValueUntilExpiry() {
        cache.put("key", "value", Duration.ofMinutes(5));

        when(clock.instant()).thenReturn(T0.plusSeconds(299));
        assertThat(cache.get("key", String.class)).contains("value");

        when(clock.instant()).thenReturn(T0.plusSeconds(300));
        assertThat(cache.get("key", String.class)).isEmpty();
    }

    @Test
    void shouldIgnoreValuesOfOtherType() {
        cache.put("key", 42, Duration.ofMinutes(5));

        assertThat(cache.get("key", String.class)).isEmpty();
        assertThat(cache.get("key", Integer.class)).contains(42);
    }

    @Test
    void shouldEvict() {
        cache.put("key", "value", Duration.ofMinutes(5));
        cache.evict("key");

        assertThat(cache.get("key", String.class)).isEmpty();
    }
}
