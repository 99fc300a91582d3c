package com.example.calendar.controllers;

import com.example.calendar.dto.CalendarSuggestion;

import java.util.Optional;

public interface GeoCalendarClient {

    /** Calendar matching the location of {@code ip}; a null ip asks for the service's default */
    Optional<CalendarSuggestion> suggest(String ip);
}
