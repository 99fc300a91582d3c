package com.example.calendar.service;

import com.example.calendar.model.HolidayEntry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Folds freshly extracted feed events into a calendar's holiday map.
 * <p>
 * Entries produced by another feed are dropped. New dates are added as active feed entries.
 * Dates that already carry an explicit {@code active} flag are left exactly as they are, so a
 * holiday the user switched off stays switched off. Entries without a feed fingerprint are
 * user entries and are never touched.
 */
@Component
public class HolidayMerger {

    /**
     * @return a new map; {@code existing} is not modified
     */
    public Map<String, HolidayEntry> merge(Map<String, HolidayEntry> existing,
                                           Map<String, String> extracted,
                                           String feedFingerprint) {
        Map<String, HolidayEntry> merged = new TreeMap<>();
        if (existing != null) {
            existing.forEach((day, entry) -> merged.put(day, entry == null ? new HolidayEntry() : entry.copy()));
        }

        merged.entrySet().removeIf(e -> e.getValue().isFromFeed() && !e.getValue().getFeed().equals(feedFingerprint));

        extracted.forEach((day, summary) -> {
            HolidayEntry current = merged.get(day);
            if (current != null && current.hasExplicitActive()) {
                return;
            }
            merged.put(day, HolidayEntry.builder()
                    .active(true)
                    .summary(summary)
                    .feed(feedFingerprint)
                    .build());
        });
        return merged;
    }
}
