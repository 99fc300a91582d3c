package com.example.calendar.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarSyncScheduler {

    private final CalendarSyncService syncService;

    @Scheduled(cron = "${calendar.sync.cron:0 30 3 * * *}")
    public void syncFeeds() {
        try {
            syncService.syncAll();
        } catch (Exception e) {
            log.error("CalendarSyncScheduler: sync pass failed: {}", e.getMessage(), e);
        }
    }
}
