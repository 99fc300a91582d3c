package com.example.calendar.service;

import biweekly.Biweekly;
import biweekly.ICalendar;
import biweekly.component.VEvent;
import biweekly.util.DateTimeComponents;
import biweekly.util.ICalDate;
import com.example.calendar.service.exception.FeedParseException;
import com.example.calendar.service.util.FeedTextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Reads a holiday feed into a date → description map.
 * <p>
 * Only events starting between one year ago and three years ahead are kept. Clock change
 * pseudo events are dropped. When several events fall on one day the last one in the feed wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayEventExtractor {

    private static final Pattern DAYLIGHT_SAVING =
            Pattern.compile("(daylight saving|sommerzeit|summertime)", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public SortedMap<String, String> extract(byte[] feed) {
        String body = FeedTextNormalizer.decode(feed);
        ICalendar ical;
        try {
            ical = Biweekly.parse(body).first();
        } catch (RuntimeException e) {
            throw new FeedParseException("Unable to parse calendar feed: " + e.getMessage(), e);
        }
        if (ical == null) {
            throw new FeedParseException("Feed contains no calendar data");
        }

        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime earliest = now.minusYears(1);
        ZonedDateTime latest = now.plusYears(3);

        SortedMap<String, String> events = new TreeMap<>();
        int skipped = 0;
        for (VEvent event : ical.getEvents()) {
            if (event.getDateStart() == null || event.getDateStart().getValue() == null) {
                skipped++;
                continue;
            }
            ICalDate start = event.getDateStart().getValue();
            ZonedDateTime startsAt = startOf(start, zone);
            if (startsAt.isBefore(earliest) || startsAt.isAfter(latest)) {
                continue;
            }
            LocalDate day = dayOf(start, startsAt);

            String comment = FeedTextNormalizer.normalize(describe(event));
            if (DAYLIGHT_SAVING.matcher(comment).find()) {
                log.debug("Ignoring clock change entry '{}' on {}", comment, day);
                continue;
            }
            events.put(day.toString(), comment);
        }

        if (skipped > 0) {
            log.debug("Ignored {} event(s) without start date", skipped);
        }
        return events;
    }

    private ZonedDateTime startOf(ICalDate start, ZoneId zone) {
        DateTimeComponents raw = start.getRawComponents();
        if (!start.hasTime() && raw != null) {
            return LocalDate.of(raw.getYear(), raw.getMonth(), raw.getDate()).atStartOfDay(zone);
        }
        return start.toInstant().atZone(zone);
    }

    // wall-clock date as written in the feed, in the event's own TZID
    private LocalDate dayOf(ICalDate start, ZonedDateTime startsAt) {
        DateTimeComponents raw = start.getRawComponents();
        if (raw != null) {
            return LocalDate.of(raw.getYear(), raw.getMonth(), raw.getDate());
        }
        return startsAt.toLocalDate();
    }

    private String describe(VEvent event) {
        if (event.getSummary() != null && event.getSummary().getValue() != null) {
            return event.getSummary().getValue();
        }
        if (event.getDescription() != null && event.getDescription().getValue() != null) {
            return event.getDescription().getValue();
        }
        return "";
    }
}
