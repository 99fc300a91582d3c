package com.example.calendar.dto;

import com.example.calendar.model.Calendar;
import com.example.calendar.service.SyncOutcome;

/**
 * Result of storing a calendar: the stored record, what the feed sync did and what the
 * default-calendar pass changed.
 */
public record CalendarMutation(Calendar calendar, SyncOutcome syncOutcome, EnforcementResult enforcement) {
}
