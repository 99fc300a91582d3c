package com.example.calendar.service;

import com.example.calendar.controllers.GeoCalendarClient;
import com.example.calendar.dto.CalendarMutation;
import com.example.calendar.dto.CalendarRequest;
import com.example.calendar.dto.CalendarSuggestion;
import com.example.calendar.model.Calendar;
import com.example.calendar.repository.CalendarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Creates or refreshes the initial default calendar from the client's location.
 * <p>
 * One lookup per client ip and hour: the last processed ip is remembered process-wide, repeated
 * calls with the same ip inside that window do nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarBootstrapService {

    static final String DONE_KEY = "Calendar.init_setup.done";
    static final Duration DONE_TTL = Duration.ofHours(1);

    private static final Pattern NON_PUBLIC_IP =
            Pattern.compile("^(::1|127\\.|10\\.|172\\.1[6-9]\\.|172\\.2[0-9]\\.|172\\.3[0-1]\\.|192\\.168\\.)");

    private final ExpiringCache cache;
    private final GeoCalendarClient geoCalendarClient;
    private final CalendarNameGenerator nameGenerator;
    private final CalendarRepository calendarRepository;
    private final CalendarService calendarService;

    private final Object gate = new Object();

    /**
     * @param ip client address, may be null
     * @return the created or updated calendar, empty when nothing was done
     */
    public Optional<Calendar> initSetup(String ip) {
        String lookupIp = publicOrNull(ip);
        if (!claim(lookupIp)) {
            log.debug("Calendar setup already done for ip={}", lookupIp);
            return Optional.empty();
        }

        Optional<CalendarSuggestion> suggestion = geoCalendarClient.suggest(lookupIp);
        if (suggestion.isEmpty()) {
            log.info("No calendar suggestion for ip={}", lookupIp);
            return Optional.empty();
        }
        CalendarSuggestion details = suggestion.get();

        Optional<Calendar> systemCalendar = calendarRepository.findFirstByDefaultCalendarTrueAndCreatedByIdAndUpdatedById(
                Calendar.SYSTEM_USER_ID, Calendar.SYSTEM_USER_ID);

        // the system calendar already holding the suggested name keeps it, uniquifying would rename it to "name (2)"
        String name = systemCalendar.map(Calendar::getName).filter(details.getName()::equals)
                .orElseGet(() -> nameGenerator.generateUniqueName(details.getName()));
        CalendarRequest request = CalendarRequest.builder()
                .name(name)
                .timezone(details.getTimezone())
                .businessHours(details.getBusinessHours() != null ? details.getBusinessHours().toString() : null)
                .icalUrl(details.getIcalUrl())
                .defaultCalendar(true)
                .actorId(Calendar.SYSTEM_USER_ID)
                .build();

        CalendarMutation mutation;
        if (systemCalendar.isPresent()) {
            mutation = calendarService.update(systemCalendar.get().getId(), request);
            log.info("Updated initial calendar {} to '{}' for ip={}", mutation.calendar().getId(), name, lookupIp);
        } else {
            mutation = calendarService.create(request);
            log.info("Created initial calendar {} '{}' for ip={}", mutation.calendar().getId(), name, lookupIp);
        }
        return Optional.of(mutation.calendar());
    }

    static String publicOrNull(String ip) {
        if (ip == null || ip.isBlank() || NON_PUBLIC_IP.matcher(ip).find()) {
            return null;
        }
        return ip;
    }

    private boolean claim(String ip) {
        synchronized (gate) {
            Optional<SetupMarker> done = cache.get(DONE_KEY, SetupMarker.class);
            if (done.isPresent() && Objects.equals(done.get().ip(), ip)) {
                return false;
            }
            cache.put(DONE_KEY, new SetupMarker(ip), DONE_TTL);
            return true;
        }
    }

    private record SetupMarker(String ip) {}
}
