package com.example.calendar.service;

import com.example.calendar.dto.EnforcementResult;
import com.example.calendar.model.Calendar;
import com.example.calendar.model.Sla;
import com.example.calendar.repository.CalendarRepository;
import com.example.calendar.repository.SlaRepository;
import com.example.calendar.service.exception.InvariantRepairException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultCalendarEnforcerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 1, 9, 0);

    private final List<Calendar> calendars = new ArrayList<>();
    private final List<Sla> slas = new ArrayList<>();

    private CalendarRepository calendarRepository;
    private SlaRepository slaRepository;
    private DefaultCalendarEnforcer enforcer;

    @BeforeEach
    void setUp() {
        calendarRepository = Mockito.mock(CalendarRepository.class);
        slaRepository = Mockito.mock(SlaRepository.class);

        when(calendarRepository.findAllByDefaultCalendarTrue())
                .thenAnswer(invocation -> calendars.stream().filter(Calendar::isDefaultCalendar).toList());
        when(calendarRepository.findFirstByDefaultCalendarTrueOrderByIdAsc())
                .thenAnswer(invocation -> calendars.stream().filter(Calendar::isDefaultCalendar)
                        .min(Comparator.comparing(Calendar::getId)));
        when(calendarRepository.findFirstByOrderByCreatedAtAscIdAsc())
                .thenAnswer(invocation -> calendars.stream()
                        .min(Comparator.comparing(Calendar::getCreatedAt).thenComparing(Calendar::getId)));
        when(calendarRepository.existsById(anyLong()))
                .thenAnswer(invocation -> calendars.stream()
                        .anyMatch(c -> c.getId().equals(invocation.getArgument(0, Long.class))));
        when(calendarRepository.save(any(Calendar.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(slaRepository.findAll()).thenAnswer(invocation -> List.copyOf(slas));
        when(slaRepository.save(any(Sla.class))).thenAnswer(invocation -> invocation.getArgument(0));

        enforcer = new DefaultCalendarEnforcer(calendarRepository, slaRepository);
    }

    @Test
    void shouldClearOtherDefaultsWhenCalendarBecomesDefault() {
        Calendar first = calendar(1L, T0, true);
        Calendar second = calendar(2L, T0.plusDays(1), true);

        EnforcementResult result = enforcer.afterSave(second);

        assertThat(first.isDefaultCalendar()).isFalse();
        assertThat(second.isDefaultCalendar()).isTrue();
        assertThat(result.demoted()).containsExactly(1L);
        assertThat(result.defaultCalendarId()).isEqualTo(2L);
        assertExactlyOneDefault();
    }

    @Test
    void shouldPromoteEarliestCalendarWhenNoneIsDefault() {
        Calendar newer = calendar(1L, T0.plusDays(2), false);
        Calendar older = calendar(2L, T0, false);
        slas.add(sla(10L, null));
        slas.add(sla(11L, 99L));
        slas.add(sla(12L, 1L));

        EnforcementResult result = enforcer.afterSave(newer);

        assertThat(older.isDefaultCalendar()).isTrue();
        assertThat(result.promoted()).isEqualTo(2L);
        assertThat(slas).extracting(Sla::getCalendarId).containsExactly(2L, 2L, 1L);
        assertThat(result.repairedSlas()).containsExactly(10L, 11L);
        assertExactlyOneDefault();
    }

    @Test
    void shouldBreakCreationTiesById() {
        calendar(2L, T0, false);
        Calendar lowerId = calendar(1L, T0, false);

        enforcer.afterDestroy();

        assertThat(lowerId.isDefaultCalendar()).isTrue();
        assertExactlyOneDefault();
    }

    @Test
    void shouldPromoteReplacementWhenDefaultIsDestroyed() {
        Calendar removed = calendar(1L, T0, true);
        Calendar remaining = calendar(2L, T0.plusDays(1), false);
        slas.add(sla(10L, 1L));
        calendars.remove(removed);

        EnforcementResult result = enforcer.afterDestroy();

        assertThat(remaining.isDefaultCalendar()).isTrue();
        assertThat(slas.get(0).getCalendarId()).isEqualTo(2L);
        assertThat(result.repairedSlas()).containsExactly(10L);
    }

    @Test
    void shouldDoNothingWhenLastCalendarIsDestroyed() {
        slas.add(sla(10L, 1L));

        EnforcementResult result = enforcer.afterDestroy();

        assertThat(result.defaultCalendarId()).isNull();
        assertThat(result.changedAnything()).isFalse();
        verify(calendarRepository, never()).save(any());
        verify(slaRepository, never()).save(any());
    }

    @Test
    void shouldBeNoOpOnConsistentCollection() {
        Calendar def = calendar(1L, T0, true);
        calendar(2L, T0.plusDays(1), false);
        slas.add(sla(10L, 2L));

        EnforcementResult result = enforcer.afterSave(def);

        assertThat(result.changedAnything()).isFalse();
        verify(calendarRepository, never()).save(any());
        verify(slaRepository, never()).save(any());
    }

    @Test
    void shouldCollapseLeftoverDuplicateDefaults() {
        Calendar older = calendar(1L, T0, true);
        Calendar newer = calendar(2L, T0.plusDays(1), true);
        Calendar changed = calendar(3L, T0.plusDays(2), false);

        EnforcementResult result = enforcer.afterSave(changed);

        assertThat(older.isDefaultCalendar()).isTrue();
        assertThat(newer.isDefaultCalendar()).isFalse();
        assertThat(result.demoted()).containsExactly(2L);
        assertExactlyOneDefault();
    }

    @Test
    void shouldContinueRepairingAfterFailedSla() {
        calendar(1L, T0, true);
        Sla failing = sla(10L, null);
        Sla fine = sla(11L, 42L);
        slas.add(failing);
        slas.add(fine);
        when(slaRepository.save(failing)).thenThrow(new IllegalStateException("row locked"));

        InvariantRepairException e = assertThrows(InvariantRepairException.class, () -> enforcer.afterDestroy());

        assertThat(e.getFailedSlaIds()).containsExactly(10L);
        assertThat(fine.getCalendarId()).isEqualTo(1L);
        verify(slaRepository).save(fine);
    }

    private void assertExactlyOneDefault() {
        assertThat(calendars).filteredOn(Calendar::isDefaultCalendar).hasSize(1);
    }

    private Calendar calendar(Long id, LocalDateTime createdAt, boolean isDefault) {
        Calendar calendar = Calendar.builder()
                .id(id)
                .name("Calendar " + id)
                .createdAt(createdAt)
                .defaultCalendar(isDefault)
                .build();
        calendars.add(calendar);
        return calendar;
    }

    private static Sla sla(Long id, Long calendarId) {
        return Sla.builder().id(id).name("SLA " + id).calendarId(calendarId).build();
    }
}
