package com.example.calendar.service;

import com.example.calendar.repository.CalendarRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CalendarNameGenerator {

    private static final int MAX_ATTEMPTS = 1000;

    private final CalendarRepository calendarRepository;

    /**
     * @return {@code candidate} if no calendar uses it yet, otherwise the first free
     * {@code "candidate (n)"} with n starting at 2
     */
    public String generateUniqueName(String candidate) {
        if (!calendarRepository.existsByName(candidate)) {
            return candidate;
        }
        for (int n = 2; n <= MAX_ATTEMPTS; n++) {
            String name = candidate + " (" + n + ")";
            if (!calendarRepository.existsByName(name)) {
                return name;
            }
        }
        throw new IllegalStateException("No free calendar name for '" + candidate + "'");
    }
}
