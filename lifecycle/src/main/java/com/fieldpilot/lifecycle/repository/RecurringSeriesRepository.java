package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.RecurringSeries;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RecurringSeriesRepository extends JpaRepository<RecurringSeries, UUID> {

    List<RecurringSeries> findByActiveTrue();

    List<RecurringSeries> findAllByOrderByCreatedAtDesc();
}
