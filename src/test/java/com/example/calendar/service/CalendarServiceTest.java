package com.example.calendar.service;

import com.example.calendar.dto.CalendarMutation;
import com.example.calendar.dto.CalendarRequest;
import com.example.calendar.dto.EnforcementResult;
import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import com.example.calendar.repository.CalendarRepository;
import com.example.calendar.service.exception.CalendarNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CalendarServiceTest {

    private CalendarRepository calendarRepository;
    private CalendarSyncService syncService;
    private CalendarSyncCache syncCache;
    private DefaultCalendarEnforcer enforcer;
    private CalendarService calendarService;

    @BeforeEach
    void setUp() {
        calendarRepository = Mockito.mock(CalendarRepository.class);
        syncService = Mockito.mock(CalendarSyncService.class);
        syncCache = Mockito.mock(CalendarSyncCache.class);
        enforcer = Mockito.mock(DefaultCalendarEnforcer.class);
        calendarService = new CalendarService(calendarRepository, new HolidayValidator(), syncService, syncCache, enforcer);

        when(calendarRepository.save(any(Calendar.class))).thenAnswer(invocation -> {
            Calendar calendar = invocation.getArgument(0);
            if (calendar.getId() == null) {
                calendar.setId(7L);
            }
            return calendar;
        });
        when(enforcer.afterSave(any())).thenReturn(new EnforcementResult(7L, List.of(), null, List.of()));
    }

    @Test
    void shouldRunSaveStepsInOrder() {
        when(syncService.sync(any(Calendar.class), eq(true))).thenReturn(SyncOutcome.SYNCED);

        CalendarMutation mutation = calendarService.create(CalendarRequest.builder()
                .name("Germany")
                .icalUrl("http://feeds.example.com/de.ics")
                .defaultCalendar(true)
                .build());

        InOrder inOrder = Mockito.inOrder(syncService, calendarRepository, syncCache, enforcer);
        inOrder.verify(syncService).sync(mutation.calendar(), true);
        inOrder.verify(calendarRepository).save(mutation.calendar());
        inOrder.verify(syncCache).remember(mutation.calendar());
        inOrder.verify(enforcer).afterSave(mutation.calendar());
        assertThat(mutation.calendar().getId()).isEqualTo(7L);
        assertThat(mutation.syncOutcome()).isEqualTo(SyncOutcome.SYNCED);
    }

    @Test
    void shouldValidateHolidaysBeforeSync() {
        when(syncService.sync(any(Calendar.class), anyBoolean())).thenAnswer(invocation -> {
            Calendar calendar = invocation.getArgument(0);
            assertThat(calendar.getPublicHolidays().get("2025-08-01").getActive()).isFalse();
            return SyncOutcome.DISABLED;
        });
        Map<String, HolidayEntry> holidays = new HashMap<>();
        holidays.put("2025-08-01", new HolidayEntry(null, "Company day", null));

        CalendarMutation mutation = calendarService.create(CalendarRequest.builder()
                .name("Office")
                .publicHolidays(holidays)
                .build());

        assertThat(mutation.calendar().getPublicHolidays().get("2025-08-01"))
                .isEqualTo(new HolidayEntry(false, "Company day", null));
        verify(syncCache, never()).remember(any());
    }

    @Test
    void shouldKeepFeedFingerprintOnUpdate() {
        Map<String, HolidayEntry> stored = new HashMap<>();
        stored.put("2025-12-25", new HolidayEntry(true, "Christmas", "abc123"));
        Calendar existing = Calendar.builder().id(3L).name("US").publicHolidays(stored).build();
        when(calendarRepository.findById(3L)).thenReturn(Optional.of(existing));
        when(syncService.sync(any(Calendar.class), eq(true))).thenReturn(SyncOutcome.CACHED);

        Map<String, HolidayEntry> edited = new HashMap<>();
        edited.put("2025-12-25", new HolidayEntry(false, "Christmas", null));
        CalendarMutation mutation = calendarService.update(3L, CalendarRequest.builder().publicHolidays(edited).build());

        assertThat(mutation.calendar().getPublicHolidays().get("2025-12-25"))
                .isEqualTo(new HolidayEntry(false, "Christmas", "abc123"));
    }

    @Test
    void shouldOnlyEnforceDefaultAfterDestroy() {
        Calendar existing = Calendar.builder().id(3L).name("US").build();
        when(calendarRepository.findById(3L)).thenReturn(Optional.of(existing));

        calendarService.destroy(3L);

        InOrder inOrder = Mockito.inOrder(calendarRepository, enforcer);
        inOrder.verify(calendarRepository).delete(existing);
        inOrder.verify(enforcer).afterDestroy();
        verify(syncService, never()).sync(any(), anyBoolean());
        verify(syncCache).forget(existing);
    }

    @Test
    void shouldFailForUnknownCalendar() {
        when(calendarRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> calendarService.update(99L, new CalendarRequest()))
                .isInstanceOf(CalendarNotFoundException.class)
                .hasMessageContaining("99");
    }
}
