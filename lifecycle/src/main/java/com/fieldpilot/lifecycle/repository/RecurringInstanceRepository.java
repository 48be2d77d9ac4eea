package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.InstanceStatus;
import com.fieldpilot.lifecycle.model.RecurringInstance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RecurringInstanceRepository extends JpaRepository<RecurringInstance, UUID> {

    List<RecurringInstance> findBySeriesIdOrderByOccurrenceDateAsc(UUID seriesId);

    /** Pending visits of one series falling inside [from, to]. */
    List<RecurringInstance> findBySeriesIdAndStatusAndOccurrenceDateBetweenOrderByOccurrenceDateAsc(
            UUID seriesId, InstanceStatus status, LocalDate from, LocalDate to);

    List<RecurringInstance> findBySeriesIdAndOccurrenceDateBetween(UUID seriesId, LocalDate from, LocalDate to);

    Optional<RecurringInstance> findByIdAndSeriesId(UUID id, UUID seriesId);

    /** Row lock so two generator runs cannot materialize the same visit twice. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM RecurringInstance i WHERE i.id = :id")
    Optional<RecurringInstance> findByIdForUpdate(@Param("id") UUID id);
}
