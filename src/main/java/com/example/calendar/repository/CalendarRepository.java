package com.example.calendar.repository;

import com.example.calendar.model.Calendar;
import com.example.calendar.model.HolidayEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface CalendarRepository extends JpaRepository<Calendar, Long> {

    Optional<Calendar> findFirstByDefaultCalendarTrueOrderByIdAsc();

    List<Calendar> findAllByDefaultCalendarTrue();

    Optional<Calendar> findFirstByOrderByCreatedAtAscIdAsc();

    Optional<Calendar> findFirstByDefaultCalendarTrueAndCreatedByIdAndUpdatedById(Long createdById, Long updatedById);

    boolean existsByName(String name);

    /** Writes only the sync columns, leaving default flag and user edits made meanwhile alone. */
    @Transactional
    @Modifying
    @Query("update Calendar c set c.publicHolidays = :holidays, c.lastLog = :lastLog, c.lastSync = :lastSync where c.id = :id")
    int updateSyncResult(@Param("id") Long id,
                         @Param("holidays") Map<String, HolidayEntry> holidays,
                         @Param("lastLog") String lastLog,
                         @Param("lastSync") LocalDateTime lastSync);
}
