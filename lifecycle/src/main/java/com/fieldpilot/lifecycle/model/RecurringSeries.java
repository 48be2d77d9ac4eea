package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A repeating service agreement, e.g. "prune the hedges every 2 weeks on Tuesday".
 *
 * The recurrence generator projects occurrence dates from this definition
 * into {@link RecurringInstance} rows and, close to the date, into Draft jobs.
 *
 * DB table: recurring_series  (Flyway V3)
 */
@Entity
@Table(name = "recurring_series")
public class RecurringSeries {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "client_id", nullable = false)
    private UUID clientId;

    @Column(name = "property_id")
    private UUID propertyId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RecurrenceFrequency frequency;

    @Column(name = "interval_count", nullable = false)
    private int intervalCount = 1;

    // Weekly alignment; null means "same weekday as the start date".
    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week")
    private DayOfWeek dayOfWeek;

    // Monthly-family alignment (1-31, clamped to month length); null means start date's day.
    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(nullable = false)
    private boolean active = true;

    @Convert(converter = CrewListConverter.class)
    @Column(name = "default_crew")
    private List<String> defaultCrew = new ArrayList<>();

    @Column(name = "visit_start_time", nullable = false)
    private LocalTime visitStartTime = LocalTime.of(8, 0);

    @Column(name = "estimated_duration_hours")
    private Double estimatedDurationHours;

    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected RecurringSeries() {}   // required by JPA

    public RecurringSeries(UUID clientId, String name, RecurrenceFrequency frequency,
                           int intervalCount, LocalDate startDate) {
        if (intervalCount < 1) {
            throw new IllegalArgumentException("intervalCount must be >= 1, was " + intervalCount);
        }
        this.clientId      = clientId;
        this.name          = name;
        this.frequency     = frequency;
        this.intervalCount = intervalCount;
        this.startDate     = startDate;
    }

    public UUID                getId()                     { return id; }
    public UUID                getClientId()               { return clientId; }
    public UUID                getPropertyId()             { return propertyId; }
    public String              getName()                   { return name; }
    public RecurrenceFrequency getFrequency()              { return frequency; }
    public int                 getIntervalCount()          { return intervalCount; }
    public DayOfWeek           getDayOfWeek()              { return dayOfWeek; }
    public Integer             getDayOfMonth()             { return dayOfMonth; }
    public LocalDate           getStartDate()              { return startDate; }
    public LocalDate           getEndDate()                { return endDate; }
    public boolean             isActive()                  { return active; }
    public List<String>        getDefaultCrew()            { return defaultCrew == null ? List.of() : defaultCrew; }
    public LocalTime           getVisitStartTime()         { return visitStartTime; }
    public Double              getEstimatedDurationHours() { return estimatedDurationHours; }
    public String              getNotes()                  { return notes; }
    public Instant             getCreatedAt()              { return createdAt; }

    public void setPropertyId(UUID propertyId)               { this.propertyId = propertyId; }
    public void setDayOfWeek(DayOfWeek dayOfWeek)            { this.dayOfWeek = dayOfWeek; }
    public void setDayOfMonth(Integer dayOfMonth)            { this.dayOfMonth = dayOfMonth; }
    public void setEndDate(LocalDate endDate)                { this.endDate = endDate; }
    public void setActive(boolean active)                    { this.active = active; }
    public void setDefaultCrew(List<String> crew)            { this.defaultCrew = new ArrayList<>(crew); }
    public void setVisitStartTime(LocalTime visitStartTime)  { this.visitStartTime = visitStartTime; }
    public void setEstimatedDurationHours(Double hours)      { this.estimatedDurationHours = hours; }
    public void setNotes(String notes)                       { this.notes = notes; }
}
