package com.example.calendar.service;

public enum SyncOutcome {
    /** no feed configured */
    DISABLED,
    /** feed synced recently, nothing fetched */
    CACHED,
    SYNCED,
    /** fetch or parse failed, see the calendar's last log */
    FAILED
}
