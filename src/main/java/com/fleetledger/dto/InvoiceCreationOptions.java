package com.fleetledger.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Caller choices for one generation call. Every header field left null falls back to a
 * default derived from the customer and the log.
 */
@Getter
@Setter
public class InvoiceCreationOptions {

    private boolean createInvoice;
    private LocalDate invoiceDate;
    private LocalDate dueDate;
    private String reference;
    private String footerText;

    public static InvoiceCreationOptions preview() {
        return new InvoiceCreationOptions();
    }

    public static InvoiceCreationOptions persist() {
        InvoiceCreationOptions o = new InvoiceCreationOptions();
        o.setCreateInvoice(true);
        return o;
    }
}
