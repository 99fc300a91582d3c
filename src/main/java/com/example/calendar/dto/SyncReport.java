package com.example.calendar.dto;

import com.example.calendar.service.SyncOutcome;

import java.util.EnumMap;
import java.util.Map;

public record SyncReport(Map<SyncOutcome, Integer> outcomes) {

    public static SyncReport of(Iterable<SyncOutcome> results) {
        Map<SyncOutcome, Integer> counts = new EnumMap<>(SyncOutcome.class);
        for (SyncOutcome outcome : results) {
            counts.merge(outcome, 1, Integer::sum);
        }
        return new SyncReport(counts);
    }

    public int count(SyncOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int total() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }
}
