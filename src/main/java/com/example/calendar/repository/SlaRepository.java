package com.example.calendar.repository;

import com.example.calendar.model.Sla;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SlaRepository extends JpaRepository<Sla, Long> {
}
