package com.example.calendar.service.exception;

/**
 * Thrown when a holiday feed cannot be retrieved. The message is the transport error text
 * and ends up in the calendar's last sync log.
 */
public class FeedFetchException extends RuntimeException {

    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
