package com.example.calendar.dto;

import java.util.List;

/**
 * What a default-calendar pass changed.
 *
 * @param defaultCalendarId default calendar after the pass, null when no calendar exists
 * @param demoted           calendars that lost the default flag
 * @param promoted          calendar promoted because no default was left, null if none
 * @param repairedSlas      SLAs pointed at the default calendar
 */
public record EnforcementResult(Long defaultCalendarId, List<Long> demoted, Long promoted, List<Long> repairedSlas) {

    public boolean changedAnything() {
        return !demoted.isEmpty() || promoted != null || !repairedSlas.isEmpty();
    }
}
