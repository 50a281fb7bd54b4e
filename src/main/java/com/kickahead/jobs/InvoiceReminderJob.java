package com.kickahead.jobs;

import org.json.JSONObject;

import java.util.List;

/**
 * Reminder about an unpaid invoice.
 *
 * <p>Arguments: {@code [recipient, invoiceNumber, amountCents]}. Registered as a child of
 * {@link ReminderJob#TYPE}, so it shares the reminder tolerance and strategy unless
 * configured otherwise.</p>
 */
public class InvoiceReminderJob extends ReminderJob {

    public static final String TYPE = "InvoiceReminderJob";

    public InvoiceReminderJob(Outbox outbox) {
        super(outbox);
    }

    @Override
    protected JSONObject buildMessage(List<Object> args) {
        String recipient = arg(args, 0, String.class);
        String invoiceNumber = arg(args, 1, String.class);
        Long amountCents = arg(args, 2, Long.class);
        if (recipient == null || invoiceNumber == null || amountCents == null) {
            throw new IllegalArgumentException("Invoice reminders need recipient, invoice number and amount");
        }

        JSONObject json = new JSONObject();
        json.put("to", recipient);
        json.put("subject", "Invoice " + invoiceNumber + " is due");
        json.put("invoice", invoiceNumber);
        json.put("amount", String.format("%d.%02d", amountCents / 100, amountCents % 100));
        return json;
    }
}
