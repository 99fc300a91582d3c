package com.example.calendar.service.exception;

public class CalendarNotFoundException extends RuntimeException {

    public CalendarNotFoundException(Long id) {
        super("Calendar " + id + " not found");
    }
}
