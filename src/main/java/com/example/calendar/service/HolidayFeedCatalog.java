package com.example.calendar.service;

import com.example.calendar.config.HolidayFeedProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Known public holiday feeds, one per country.
 */
@Service
@RequiredArgsConstructor
public class HolidayFeedCatalog {

    private static final String DOMAIN = "{domain}";

    private final HolidayFeedProperties properties;

    /** @return feed url → country, in configuration order */
    public Map<String, String> icalFeeds() {
        Map<String, String> feeds = new LinkedHashMap<>();
        properties.countries().forEach((country, domain) ->
                feeds.put(properties.url().replace(DOMAIN, domain), country));
        return Collections.unmodifiableMap(feeds);
    }
}
