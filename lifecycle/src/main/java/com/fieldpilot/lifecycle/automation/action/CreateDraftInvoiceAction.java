package com.fieldpilot.lifecycle.automation.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionException;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.automation.gateway.InvoiceGateway;
import com.fieldpilot.lifecycle.model.Invoice;
import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Opens a DRAFT invoice for a completed job.
 *
 * Idempotent: a second firing for the same job (redelivered event, a job
 * completed again after an invoice void) finds the existing invoice and
 * reports success without creating another. The unique job_id key covers
 * two firings racing past the existence check.
 *
 * Amount is the sum of price × quantity over {@code lineItems} in the job's
 * cost payload; due date is {@code netDays} (default 30) from today.
 */
@Component
public class CreateDraftInvoiceAction implements AutomationAction {

    private static final Logger log = LoggerFactory.getLogger(CreateDraftInvoiceAction.class);

    private static final int DEFAULT_NET_DAYS = 30;

    private final InvoiceGateway invoices;
    private final JobStore       jobs;
    private final ObjectMapper   mapper;
    private final Clock          clock;

    public CreateDraftInvoiceAction(InvoiceGateway invoices, JobStore jobs, ObjectMapper mapper, Clock clock) {
        this.invoices = invoices;
        this.jobs     = jobs;
        this.mapper   = mapper;
        this.clock    = clock;
    }

    @Override
    public String name() {
        return "create_draft_invoice";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        Job job = jobs.findById(ctx.jobId()).orElseThrow(() ->
                new ActionException(ActionException.Kind.NOT_FOUND, "Job " + ctx.jobId() + " not found"));

        if (invoices.findByJob(job.getId()).isPresent()) {
            return ActionResult.ok("invoice already exists for job " + job.getId());
        }

        BigDecimal amount = amountOf(job);
        int netDays = netDays(ctx);
        LocalDate due = LocalDate.now(clock).plusDays(netDays);
        try {
            Invoice invoice = invoices.createDraft(job.getId(), job.getClientId(), amount, due);
            log.info("Draft invoice {} created for job {}: amount={} due={}", invoice.getId(), job.getId(), amount, due);
            return ActionResult.ok("draft invoice " + invoice.getId() + " created, amount " + amount);
        } catch (DataIntegrityViolationException e) {
            log.info("Invoice for job {} was created concurrently; treating as done", job.getId());
            return ActionResult.ok("invoice already exists for job " + job.getId());
        }
    }

    BigDecimal amountOf(Job job) {
        String payload = job.getCostPayload();
        if (payload == null || payload.isBlank()) {
            return BigDecimal.ZERO.setScale(2);
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG,
                    "cost payload of job " + job.getId() + " is not valid JSON", e);
        }
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode item : root.path("lineItems")) {
            total = total.add(decimal(item, "price", BigDecimal.ZERO)
                    .multiply(decimal(item, "quantity", BigDecimal.ONE)));
        }
        return total.setScale(2, RoundingMode.HALF_UP);
    }

    /** Numeric or numeric-string field; {@code fallback} when absent. */
    private static BigDecimal decimal(JsonNode item, String field, BigDecimal fallback) {
        JsonNode node = item.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG,
                    "line item " + field + " '" + node.asText() + "' is not a number");
        }
    }

    private static int netDays(ActionContext ctx) {
        String raw = ctx.configString("netDays", null);
        if (raw == null) {
            return DEFAULT_NET_DAYS;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG, "netDays must be a whole number, was '" + raw + "'");
        }
    }
}
