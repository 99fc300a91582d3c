package com.example.calendar.service;

import com.example.calendar.model.HolidayEntry;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes holidays submitted with a calendar before it is stored.
 * <p>
 * Every entry gets an explicit {@code active} flag, and an entry that came from a feed keeps its
 * feed fingerprint even when the submitted copy lost it.
 */
@Component
public class HolidayValidator {

    public Map<String, HolidayEntry> validate(Map<String, HolidayEntry> holidays, Map<String, HolidayEntry> previous) {
        Map<String, HolidayEntry> validated = new TreeMap<>();
        if (holidays == null) {
            return validated;
        }

        holidays.forEach((day, submitted) -> {
            requireIsoDate(day);
            HolidayEntry entry = submitted == null ? new HolidayEntry() : submitted.copy();

            HolidayEntry before = previous != null ? previous.get(day) : null;
            if (before != null && before.isFromFeed()) {
                entry.setFeed(before.getFeed());
            }
            entry.setActive(Boolean.TRUE.equals(entry.getActive()));
            validated.put(day, entry);
        });
        return validated;
    }

    private void requireIsoDate(String day) {
        try {
            LocalDate.parse(day);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Holiday date must be YYYY-MM-DD, got '" + day + "'");
        }
    }
}
