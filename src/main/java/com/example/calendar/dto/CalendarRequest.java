package com.example.calendar.dto;

import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Calendar attributes sent by a client. On update, null fields keep their stored value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalendarRequest {
    private String name;
    private String timezone;
    private String businessHours;
    private Map<String, HolidayEntry> publicHolidays;
    private String icalUrl;
    private Boolean defaultCalendar;

    /** user performing the change */
    private Long actorId;

    public Calendar toCalendar() {
        Calendar calendar = new Calendar();
        applyTo(calendar);
        calendar.setCreatedById(actorId);
        return calendar;
    }

    public void applyTo(Calendar calendar) {
        if (name != null) {
            calendar.setName(name);
        }
        if (timezone != null) {
            calendar.setTimezone(timezone);
        }
        if (businessHours != null) {
            calendar.setBusinessHours(businessHours);
        }
        if (publicHolidays != null) {
            calendar.setPublicHolidays(publicHolidays);
        }
        if (icalUrl != null) {
            calendar.setIcalUrl(icalUrl.isBlank() ? null : icalUrl);
        }
        if (defaultCalendar != null) {
            calendar.setDefaultCalendar(defaultCalendar);
        }
        if (actorId != null) {
            calendar.setUpdatedById(actorId);
        }
    }
}
