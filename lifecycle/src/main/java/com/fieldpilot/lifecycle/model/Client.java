package com.fieldpilot.lifecycle.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The slice of the CRM client record this service mutates: its category.
 *
 * DB table: clients  (Flyway V4)
 */
@Entity
@Table(name = "clients")
public class Client {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ClientCategory category = ClientCategory.POTENTIAL;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Client() {}   // required by JPA

    public Client(UUID id, String name) {
        this.id   = id;
        this.name = name;
    }

    public UUID           getId()        { return id; }
    public String         getName()      { return name; }
    public ClientCategory getCategory()  { return category; }
    public Instant        getUpdatedAt() { return updatedAt; }

    public void setCategory(ClientCategory category) { this.category = category; }
}
