package com.example.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Calendar proposed by the geo lookup service for a client location. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendarSuggestion {
    private String name;
    private String timezone;

    @JsonProperty("business_hours")
    private JsonNode businessHours;

    @JsonProperty("ical_url")
    private String icalUrl;
}
