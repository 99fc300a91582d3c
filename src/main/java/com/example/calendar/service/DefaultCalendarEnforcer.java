package com.example.calendar.service;

import com.example.calendar.dto.EnforcementResult;
import com.example.calendar.model.Calendar;
import com.example.calendar.model.Sla;
import com.example.calendar.repository.CalendarRepository;
import com.example.calendar.repository.SlaRepository;
import com.example.calendar.service.exception.InvariantRepairException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps exactly one default calendar and makes every SLA point at an existing calendar.
 * <p>
 * Passes read and write the whole collection, so they run one at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultCalendarEnforcer {

    private final CalendarRepository calendarRepository;
    private final SlaRepository slaRepository;

    private final ReentrantLock lock = new ReentrantLock();

    /** Runs after a calendar was created or updated. */
    public EnforcementResult afterSave(Calendar changed) {
        lock.lock();
        try {
            List<Long> demoted = propagateDefault(changed);
            return finish(demoted);
        } finally {
            lock.unlock();
        }
    }

    /** Runs after a calendar was deleted. */
    public EnforcementResult afterDestroy() {
        lock.lock();
        try {
            return finish(List.of());
        } finally {
            lock.unlock();
        }
    }

    private EnforcementResult finish(List<Long> propagated) {
        List<Long> demoted = new ArrayList<>(propagated);
        Long promoted = promoteIfOrphaned();
        demoted.addAll(dropExtraDefaults());
        Optional<Calendar> defaultCalendar = calendarRepository.findFirstByDefaultCalendarTrueOrderByIdAsc();
        List<Long> repaired = defaultCalendar.map(this::repairSlas).orElse(List.of());
        return new EnforcementResult(defaultCalendar.map(Calendar::getId).orElse(null), demoted, promoted, repaired);
    }

    List<Long> propagateDefault(Calendar changed) {
        if (!changed.isDefaultCalendar()) {
            return List.of();
        }
        List<Long> demoted = new ArrayList<>();
        for (Calendar other : calendarRepository.findAllByDefaultCalendarTrue()) {
            if (other.getId().equals(changed.getId())) {
                continue;
            }
            other.setDefaultCalendar(false);
            calendarRepository.save(other);
            demoted.add(other.getId());
        }
        if (!demoted.isEmpty()) {
            log.info("Calendar {} is the new default, cleared default on {}", changed.getId(), demoted);
        }
        return demoted;
    }

    Long promoteIfOrphaned() {
        if (calendarRepository.findFirstByDefaultCalendarTrueOrderByIdAsc().isPresent()) {
            return null;
        }
        return calendarRepository.findFirstByOrderByCreatedAtAscIdAsc()
                .map(first -> {
                    first.setDefaultCalendar(true);
                    calendarRepository.save(first);
                    log.info("No default calendar left, promoted calendar {}", first.getId());
                    return first.getId();
                })
                .orElse(null);
    }

    /** Leftover duplicates, e.g. from rows written outside this service: the oldest one wins. */
    List<Long> dropExtraDefaults() {
        List<Calendar> defaults = new ArrayList<>(calendarRepository.findAllByDefaultCalendarTrue());
        if (defaults.size() < 2) {
            return List.of();
        }
        defaults.sort(Comparator.comparing(Calendar::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Calendar::getId));
        List<Long> demoted = new ArrayList<>();
        for (Calendar extra : defaults.subList(1, defaults.size())) {
            extra.setDefaultCalendar(false);
            calendarRepository.save(extra);
            demoted.add(extra.getId());
        }
        log.warn("Found {} default calendars, kept {} and cleared {}", defaults.size(), defaults.get(0).getId(), demoted);
        return demoted;
    }

    List<Long> repairSlas(Calendar defaultCalendar) {
        List<Long> repaired = new ArrayList<>();
        List<Long> failed = new ArrayList<>();
        RuntimeException firstFailure = null;

        for (Sla sla : slaRepository.findAll()) {
            if (sla.getCalendarId() != null && calendarRepository.existsById(sla.getCalendarId())) {
                continue;
            }
            Long previous = sla.getCalendarId();
            try {
                sla.setCalendarId(defaultCalendar.getId());
                slaRepository.save(sla);
                repaired.add(sla.getId());
                log.info("SLA {} pointed at calendar {} instead of {}", sla.getId(), defaultCalendar.getId(), previous);
            } catch (RuntimeException e) {
                log.error("Failed to reassign calendar of SLA {}: {}", sla.getId(), e.toString());
                failed.add(sla.getId());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }

        if (!failed.isEmpty()) {
            throw new InvariantRepairException(failed, firstFailure);
        }
        return repaired;
    }
}
