package com.example.calendar.service.util;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Identity of a holiday feed: MD5 hex of the feed url string. Content changes behind the same
 * url keep the same fingerprint.
 */
public final class FeedFingerprint {

    private FeedFingerprint() {
    }

    public static String of(String icalUrl) {
        return DigestUtils.md5DigestAsHex(icalUrl.getBytes(StandardCharsets.UTF_8));
    }
}
