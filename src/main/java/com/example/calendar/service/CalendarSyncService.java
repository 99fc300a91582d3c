package com.example.calendar.service;

import com.example.calendar.config.CalendarConfig;
import com.example.calendar.dto.SyncReport;
import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import com.example.calendar.repository.CalendarRepository;
import com.example.calendar.service.util.FeedFingerprint;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Pulls a calendar's holiday feed and merges it into the stored holidays.
 * <p>
 * A broken feed never breaks the calendar: the error is kept in {@code lastLog}, the
 * holidays stay as they were and {@code lastSync} is still updated.
 */
@Slf4j
@Service
public class CalendarSyncService {

    private final CalendarRepository calendarRepository;
    private final CalendarSyncCache syncCache;
    private final FeedFetcher feedFetcher;
    private final HolidayEventExtractor extractor;
    private final HolidayMerger merger;
    private final Clock clock;
    private final ExecutorService workers;

    public CalendarSyncService(CalendarRepository calendarRepository,
                               CalendarSyncCache syncCache,
                               FeedFetcher feedFetcher,
                               HolidayEventExtractor extractor,
                               HolidayMerger merger,
                               Clock clock,
                               CalendarConfig config) {
        this.calendarRepository = calendarRepository;
        this.syncCache = syncCache;
        this.feedFetcher = feedFetcher;
        this.extractor = extractor;
        this.merger = merger;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(Math.max(1, config.getSyncPoolSize()));
    }

    /**
     * Syncs one calendar.
     *
     * @param withoutSave leave persisting to the caller, used while the calendar itself is being saved
     */
    public SyncOutcome sync(Calendar calendar, boolean withoutSave) {
        if (!calendar.hasFeed()) {
            return SyncOutcome.DISABLED;
        }
        if (syncCache.isFresh(calendar)) {
            log.debug("Calendar {} synced recently from {}, skipping", calendar.getId(), calendar.getIcalUrl());
            return SyncOutcome.CACHED;
        }

        SyncOutcome outcome;
        try {
            String icalUrl = calendar.getIcalUrl();
            Map<String, String> events = extractor.extract(feedFetcher.fetch(icalUrl));
            Map<String, HolidayEntry> merged =
                    merger.merge(calendar.getPublicHolidays(), events, FeedFingerprint.of(icalUrl));

            calendar.setPublicHolidays(merged);
            calendar.setLastLog(null);
            syncCache.remember(calendar);
            log.info("Calendar {} synced {} feed event(s) from {}", calendar.getId(), events.size(), icalUrl);
            outcome = SyncOutcome.SYNCED;
        } catch (RuntimeException e) {
            calendar.setLastLog(describe(e));
            log.warn("Calendar {} sync from {} failed: {}", calendar.getId(), calendar.getIcalUrl(), e.toString());
            outcome = SyncOutcome.FAILED;
        }

        calendar.setLastSync(LocalDateTime.now(clock));
        if (!withoutSave) {
            store(calendar);
        }
        return outcome;
    }

    /**
     * Syncs every calendar on the worker pool and waits for all of them.
     */
    public SyncReport syncAll() {
        List<Calendar> calendars = calendarRepository.findAll();
        List<CompletableFuture<SyncOutcome>> jobs = new ArrayList<>(calendars.size());
        for (Calendar calendar : calendars) {
            jobs.add(CompletableFuture.supplyAsync(() -> syncQuietly(calendar), workers));
        }
        List<SyncOutcome> results = jobs.stream().map(CompletableFuture::join).toList();

        SyncReport report = SyncReport.of(results);
        log.info("Synced {} calendar(s): {}", report.total(), report.outcomes());
        return report;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }

    private SyncOutcome syncQuietly(Calendar calendar) {
        try {
            return sync(calendar, false);
        } catch (RuntimeException e) {
            // only reachable when saving the calendar fails
            log.error("Calendar {} could not be stored after sync: {}", calendar.getId(), e.toString());
            return SyncOutcome.FAILED;
        }
    }

    // the row may have changed during the fetch, so only the sync columns are written
    private void store(Calendar calendar) {
        if (calendar.getId() == null) {
            calendarRepository.save(calendar);
            return;
        }
        int updated = calendarRepository.updateSyncResult(calendar.getId(), calendar.getPublicHolidays(),
                calendar.getLastLog(), calendar.getLastSync());
        if (updated == 0) {
            log.warn("Calendar {} disappeared during sync, result dropped", calendar.getId());
        }
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
