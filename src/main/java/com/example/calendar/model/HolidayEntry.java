package com.example.calendar.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One public holiday of a calendar.
 * <p>
 * {@code active == null} means the flag was never set explicitly. Once set, by a user or by a
 * feed sync, the entry belongs to the user and later syncs leave it alone.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HolidayEntry {

    private Boolean active;

    private String summary;

    /** fingerprint of the feed url that produced this entry, null for user entries */
    private String feed;

    @JsonIgnore
    public boolean hasExplicitActive() {
        return active != null;
    }

    @JsonIgnore
    public boolean isFromFeed() {
        return feed != null;
    }

    public HolidayEntry copy() {
        return toBuilder().build();
    }
}
