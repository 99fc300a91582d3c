package com.example.calendar.service.exception;

/**
 * Thrown when a retrieved feed does not contain calendar data.
 */
public class FeedParseException extends RuntimeException {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
