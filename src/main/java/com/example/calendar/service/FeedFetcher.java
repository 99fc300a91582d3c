package com.example.calendar.service;

/**
 * Loads the raw bytes of a holiday feed.
 */
public interface FeedFetcher {

    /**
     * @param location http(s) url or local file path
     * @return the feed body
     * @throws com.example.calendar.service.exception.FeedFetchException when the feed cannot be read
     */
    byte[] fetch(String location);
}
