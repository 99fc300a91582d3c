package com.example.calendar.controllers.impl;

import com.example.calendar.controllers.GeoCalendarClient;
import com.example.calendar.dto.CalendarSuggestion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GeoCalendarClientImpl implements GeoCalendarClient {

    private final RestTemplate restTemplate;

    @Value("${calendar.geo.base-url:}")
    private String baseUrl;

    @Override
    public Optional<CalendarSuggestion> suggest(String ip) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.debug("No geo service configured, skipping calendar suggestion");
            return Optional.empty();
        }
        try {
            UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/calendar");
            if (ip != null) {
                uri.queryParam("ip", ip);
            }
            CalendarSuggestion suggestion = restTemplate.getForObject(uri.toUriString(), CalendarSuggestion.class);
            if (suggestion == null || suggestion.getName() == null || suggestion.getName().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(suggestion);
        } catch (HttpStatusCodeException e) {
            log.warn("Geo calendar lookup for ip={} failed: {} : {}", ip, e.getStatusCode(), e.getResponseBodyAsString());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Geo calendar lookup for ip={} failed: {}", ip, e.getMessage());
            return Optional.empty();
        }
    }
}
