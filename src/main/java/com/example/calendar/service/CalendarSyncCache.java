package com.example.calendar.service;

import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Limits feed fetches to one per calendar every {@link #TTL} as long as the last attempt
 * succeeded. Failed syncs are never recorded, so an error state always retries.
 */
@Component
@RequiredArgsConstructor
public class CalendarSyncCache {

    static final Duration TTL = Duration.ofDays(5);

    private final ExpiringCache cache;

    public boolean isFresh(Calendar calendar) {
        if (calendar.getId() == null || calendar.hasSyncError()) {
            return false;
        }
        return lookup(calendar)
                .filter(synced -> Objects.equals(synced.icalUrl(), calendar.getIcalUrl()))
                .isPresent();
    }

    public void remember(Calendar calendar) {
        if (calendar.getId() == null) {
            return;
        }
        Map<String, HolidayEntry> snapshot = new TreeMap<>();
        if (calendar.getPublicHolidays() != null) {
            calendar.getPublicHolidays().forEach((day, entry) -> snapshot.put(day, entry.copy()));
        }
        cache.put(key(calendar), new SyncedFeed(snapshot, calendar.getIcalUrl()), TTL);
    }

    public void forget(Calendar calendar) {
        cache.evict(key(calendar));
    }

    Optional<SyncedFeed> lookup(Calendar calendar) {
        return cache.get(key(calendar), SyncedFeed.class);
    }

    private String key(Calendar calendar) {
        return "CalendarIcal::" + calendar.getId();
    }

    record SyncedFeed(Map<String, HolidayEntry> publicHolidays, String icalUrl) {}
}
