package com.example.calendar.controllers;

import com.example.calendar.dto.CalendarMutation;
import com.example.calendar.dto.CalendarRequest;
import com.example.calendar.dto.SyncReport;
import com.example.calendar.model.Calendar;
import com.example.calendar.service.CalendarBootstrapService;
import com.example.calendar.service.CalendarService;
import com.example.calendar.service.CalendarSyncService;
import com.example.calendar.service.HolidayFeedCatalog;
import com.example.calendar.service.SyncOutcome;
import com.example.calendar.service.TimezoneCatalog;
import com.example.calendar.service.exception.CalendarNotFoundException;
import com.example.calendar.service.exception.InvariantRepairException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/calendars")
@RequiredArgsConstructor
@Slf4j
public class CalendarController {

    private final CalendarService calendarService;
    private final CalendarSyncService syncService;
    private final CalendarBootstrapService bootstrapService;
    private final HolidayFeedCatalog feedCatalog;
    private final TimezoneCatalog timezoneCatalog;

    @GetMapping
    public List<Calendar> list() {
        return calendarService.findAll();
    }

    @GetMapping("/{id}")
    public Calendar get(@PathVariable Long id) {
        return calendarService.get(id);
    }

    @GetMapping("/default")
    public ResponseEntity<Calendar> defaultCalendar() {
        return ResponseEntity.of(calendarService.findDefault());
    }

    @PostMapping
    public ResponseEntity<CalendarMutation> create(@RequestBody CalendarRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(calendarService.create(request));
    }

    @PutMapping("/{id}")
    public CalendarMutation update(@PathVariable Long id, @RequestBody CalendarRequest request) {
        return calendarService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        calendarService.destroy(id);
        return ResponseEntity.noContent().build();
    }

    /** Sync one calendar's holiday feed now. */
    @PostMapping("/{id}/sync")
    public Map<String, SyncOutcome> sync(@PathVariable Long id) {
        return Map.of("outcome", calendarService.sync(id));
    }

    @PostMapping("/sync")
    public SyncReport syncAll() {
        return syncService.syncAll();
    }

    /** First-run setup of the default calendar from the caller's location. */
    @PostMapping("/init-setup")
    public ResponseEntity<Calendar> initSetup(HttpServletRequest request) {
        return bootstrapService.initSetup(request.getRemoteAddr())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/ical-feeds")
    public Map<String, String> icalFeeds() {
        return feedCatalog.icalFeeds();
    }

    @GetMapping("/timezones")
    public Map<String, Integer> timezones() {
        return timezoneCatalog.timezones();
    }

    @ExceptionHandler(CalendarNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(CalendarNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(InvariantRepairException.class)
    public ResponseEntity<Map<String, String>> repairFailed(InvariantRepairException e) {
        log.error("Default calendar repair incomplete: {}", e.getMessage());
        return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
    }
}
