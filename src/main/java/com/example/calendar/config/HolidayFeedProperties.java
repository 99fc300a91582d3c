package com.example.calendar.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog of public holiday feeds.
 *
 * @param url       feed url template, {@code {domain}} is replaced by the country's feed domain
 * @param countries country name to feed domain, in display order
 */
@ConfigurationProperties(prefix = "calendar.holiday-feeds")
public record HolidayFeedProperties(String url, Map<String, String> countries) {

    public HolidayFeedProperties {
        if (url == null) {
            url = "";
        }
        countries = countries == null ? Map.of() : new LinkedHashMap<>(countries);
    }
}
