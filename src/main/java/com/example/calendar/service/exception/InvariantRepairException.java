package com.example.calendar.service.exception;

import java.util.List;

/**
 * Thrown after a default-calendar pass when one or more SLAs could not be pointed at the
 * default calendar. The remaining SLAs have been repaired already.
 */
public class InvariantRepairException extends RuntimeException {

    private final List<Long> failedSlaIds;

    public InvariantRepairException(List<Long> failedSlaIds, Throwable firstCause) {
        super("Could not reassign calendar of SLA(s) " + failedSlaIds, firstCause);
        this.failedSlaIds = List.copyOf(failedSlaIds);
    }

    public List<Long> getFailedSlaIds() {
        return failedSlaIds;
    }
}
