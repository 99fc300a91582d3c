package com.example.calendar.service;

import com.example.calendar.dto.CalendarMutation;
import com.example.calendar.dto.CalendarRequest;
import com.example.calendar.dto.EnforcementResult;
import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import com.example.calendar.repository.CalendarRepository;
import com.example.calendar.service.exception.CalendarNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every calendar change. Saving runs, in order:
 * holiday validation, an in-memory feed sync, the save itself and the default-calendar pass.
 * Deleting runs only the default-calendar pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarService {

    private final CalendarRepository calendarRepository;
    private final HolidayValidator holidayValidator;
    private final CalendarSyncService syncService;
    private final CalendarSyncCache syncCache;
    private final DefaultCalendarEnforcer enforcer;

    public List<Calendar> findAll() {
        return calendarRepository.findAll();
    }

    public Calendar get(Long id) {
        return calendarRepository.findById(id).orElseThrow(() -> new CalendarNotFoundException(id));
    }

    public Optional<Calendar> findDefault() {
        return calendarRepository.findFirstByDefaultCalendarTrueOrderByIdAsc();
    }

    public CalendarMutation create(CalendarRequest request) {
        Calendar calendar = request.toCalendar();
        return store(calendar, null);
    }

    public CalendarMutation update(Long id, CalendarRequest request) {
        Calendar calendar = get(id);
        Map<String, HolidayEntry> previous = calendar.getPublicHolidays();
        request.applyTo(calendar);
        return store(calendar, previous);
    }

    public void destroy(Long id) {
        Calendar calendar = get(id);
        calendarRepository.delete(calendar);
        syncCache.forget(calendar);
        log.info("Calendar {} '{}' deleted", id, calendar.getName());
        enforcer.afterDestroy();
    }

    /** Syncs a stored calendar right away, persisting the result. */
    public SyncOutcome sync(Long id) {
        return syncService.sync(get(id), false);
    }

    private CalendarMutation store(Calendar calendar, Map<String, HolidayEntry> previous) {
        calendar.setPublicHolidays(holidayValidator.validate(calendar.getPublicHolidays(), previous));

        SyncOutcome syncOutcome = syncService.sync(calendar, true);

        Calendar saved = calendarRepository.save(calendar);
        if (syncOutcome == SyncOutcome.SYNCED) {
            syncCache.remember(saved);
        }
        log.info("Calendar {} '{}' stored (feed: {})", saved.getId(), saved.getName(), syncOutcome);

        EnforcementResult enforcement = enforcer.afterSave(saved);
        return new CalendarMutation(saved, syncOutcome, enforcement);
    }
}
