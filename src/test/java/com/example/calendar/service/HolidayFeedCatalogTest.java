package com.example.calendar.service;

import com.example.calendar.config.HolidayFeedProperties;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HolidayFeedCatalogTest {

    @Test
    void shouldExpandUrlTemplatePerCountry() {
        Map<String, String> countries = new LinkedHashMap<>();
        countries.put("Germany", "de.german");
        countries.put("United States", "en.usa");
        HolidayFeedCatalog catalog = new HolidayFeedCatalog(
                new HolidayFeedProperties("https://feeds.example.com/{domain}/basic.ics", countries));

        assertThat(catalog.icalFeeds()).containsExactly(
                Map.entry("https://feeds.example.com/de.german/basic.ics", "Germany"),
                Map.entry("https://feeds.example.com/en.usa/basic.ics", "United States"));
    }

    @Test
    void shouldBeEmptyWithoutConfiguration() {
        assertThat(new HolidayFeedCatalog(new HolidayFeedProperties(null, null)).icalFeeds()).isEmpty();
    }
}
