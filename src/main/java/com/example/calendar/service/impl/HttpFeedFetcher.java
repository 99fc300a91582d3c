package com.example.calendar.service.impl;

import com.example.calendar.service.FeedFetcher;
import com.example.calendar.service.exception.FeedFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class HttpFeedFetcher implements FeedFetcher {

    private static final Pattern REMOTE = Pattern.compile("^http", Pattern.CASE_INSENSITIVE);

    private final RestTemplate restTemplate;

    @Override
    public byte[] fetch(String location) {
        if (REMOTE.matcher(location).find()) {
            return download(location);
        }
        return readFile(location);
    }

    private byte[] download(String url) {
        try {
            ResponseEntity<byte[]> response = restTemplate.getForEntity(URI.create(url), byte[].class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new FeedFetchException("Unexpected status " + response.getStatusCode().value() + " for " + url);
            }
            byte[] body = response.getBody();
            log.debug("Downloaded {} bytes from {}", body != null ? body.length : 0, url);
            return body != null ? body : new byte[0];
        } catch (HttpStatusCodeException e) {
            throw new FeedFetchException("HTTP " + e.getStatusCode().value() + " for " + url, e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new FeedFetchException(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }
    }

    private byte[] readFile(String path) {
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException | RuntimeException e) {
            throw new FeedFetchException("Cannot read " + path + ": " + e, e);
        }
    }
}
