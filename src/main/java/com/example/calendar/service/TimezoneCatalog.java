package com.example.calendar.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
public class TimezoneCatalog {

    // Area/Location ids only, skips aliases like "GMT0" or "SystemV/..."
    private static final Pattern REGION_ZONE =
            Pattern.compile("^(Africa|America|Antarctica|Asia|Atlantic|Australia|Europe|Indian|Pacific)/.+");

    private final Clock clock;

    /** @return time zone id → current UTC offset in whole hours */
    public Map<String, Integer> timezones() {
        Instant now = clock.instant();
        Map<String, Integer> zones = new TreeMap<>();
        for (String id : ZoneId.getAvailableZoneIds()) {
            if (!REGION_ZONE.matcher(id).matches()) {
                continue;
            }
            int offsetSeconds = ZoneId.of(id).getRules().getOffset(now).getTotalSeconds();
            zones.put(id, offsetSeconds / 3600);
        }
        return zones;
    }
}
