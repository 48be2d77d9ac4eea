package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    Optional<Invoice> findByJobId(UUID jobId);

    long countByJobId(UUID jobId);
}
