package com.example.calendar.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Map;

@Entity
@Table(name = "calendars")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Calendar {

    public static final long SYSTEM_USER_ID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    private String timezone;

    /** weekday schedule, kept as-is */
    @Column(name = "business_hours", columnDefinition = "text")
    private String businessHours;

    @Convert(converter = HolidayMapConverter.class)
    @Column(name = "public_holidays", columnDefinition = "text")
    private Map<String, HolidayEntry> publicHolidays;

    @Column(name = "ical_url")
    private String icalUrl;

    @Column(name = "is_default", nullable = false)
    private boolean defaultCalendar;

    @Column(name = "last_sync")
    private LocalDateTime lastSync;

    @Column(name = "last_log", columnDefinition = "text")
    private String lastLog;

    @Column(name = "created_by_id")
    private Long createdById;

    @Column(name = "updated_by_id")
    private Long updatedById;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasFeed() {
        return icalUrl != null && !icalUrl.isBlank();
    }

    public boolean hasSyncError() {
        return lastLog != null && !lastLog.isEmpty();
    }

    public boolean isSystemOwned() {
        return Long.valueOf(SYSTEM_USER_ID).equals(createdById) && Long.valueOf(SYSTEM_USER_ID).equals(updatedById);
    }
}
