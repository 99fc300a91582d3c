package com.example.calendar.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/** Stores the date → holiday map as a JSON document. */
@Converter
public class HolidayMapConverter implements AttributeConverter<Map<String, HolidayEntry>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<TreeMap<String, HolidayEntry>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, HolidayEntry> holidays) {
        if (holidays == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(new TreeMap<>(holidays));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize public holidays", e);
        }
    }

    @Override
    public Map<String, HolidayEntry> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read public holidays", e);
        }
    }
}
