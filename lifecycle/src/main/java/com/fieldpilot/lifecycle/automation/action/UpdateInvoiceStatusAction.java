package com.fieldpilot.lifecycle.automation.action;

import com.fieldpilot.lifecycle.automation.ActionContext;
import com.fieldpilot.lifecycle.automation.ActionException;
import com.fieldpilot.lifecycle.automation.ActionResult;
import com.fieldpilot.lifecycle.automation.AutomationAction;
import com.fieldpilot.lifecycle.automation.gateway.InvoiceGateway;
import com.fieldpilot.lifecycle.model.Invoice;
import com.fieldpilot.lifecycle.model.InvoiceStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/** Sets the job's invoice to config {@code status}; a job without an invoice is a no-op. */
@Component
public class UpdateInvoiceStatusAction implements AutomationAction {

    private final InvoiceGateway invoices;

    public UpdateInvoiceStatusAction(InvoiceGateway invoices) {
        this.invoices = invoices;
    }

    @Override
    public String name() {
        return "update_invoice_status";
    }

    @Override
    public ActionResult execute(ActionContext ctx) {
        InvoiceStatus target = parse(ctx.requireConfig("status"));
        Optional<Invoice> invoice = invoices.findByJob(ctx.jobId());
        if (invoice.isEmpty()) {
            return ActionResult.ok("job " + ctx.jobId() + " has no invoice; nothing to update");
        }
        if (invoice.get().getStatus() == target) {
            return ActionResult.ok("invoice " + invoice.get().getId() + " already " + target);
        }
        invoices.updateStatus(invoice.get(), target);
        return ActionResult.ok("invoice " + invoice.get().getId() + " set to " + target);
    }

    private static InvoiceStatus parse(String raw) {
        try {
            return InvoiceStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ActionException(ActionException.Kind.INVALID_CONFIG, "unknown invoice status '" + raw + "'");
        }
    }
}
