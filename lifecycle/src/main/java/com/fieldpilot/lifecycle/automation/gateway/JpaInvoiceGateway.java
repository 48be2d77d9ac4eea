package com.fieldpilot.lifecycle.automation.gateway;

import com.fieldpilot.lifecycle.model.Invoice;
import com.fieldpilot.lifecycle.model.InvoiceStatus;
import com.fieldpilot.lifecycle.repository.InvoiceRepository;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaInvoiceGateway implements InvoiceGateway {

    private final InvoiceRepository invoiceRepo;

    public JpaInvoiceGateway(InvoiceRepository invoiceRepo) {
        this.invoiceRepo = invoiceRepo;
    }

    @Override
    public Optional<Invoice> findByJob(UUID jobId) {
        return invoiceRepo.findByJobId(jobId);
    }

    @Override
    public Invoice createDraft(UUID jobId, UUID clientId, BigDecimal amount, LocalDate dueDate) {
        // Flush so a unique-key clash surfaces here, not at some later commit.
        return invoiceRepo.saveAndFlush(new Invoice(jobId, clientId, amount, dueDate));
    }

    @Override
    public Invoice updateStatus(Invoice invoice, InvoiceStatus status) {
        invoice.setStatus(status);
        return invoiceRepo.save(invoice);
    }
}
