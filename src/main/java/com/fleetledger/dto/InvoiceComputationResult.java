package com.fleetledger.dto;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

@Getter
@ToString
public final class InvoiceComputationResult {

    private final List<InvoiceLine> lines;
    private final InvoiceTotals totals;
    private final List<String> warnings;
    private final Long customerId;
    private final String customerName;
    private final Long invoiceId; // null unless persisted

    public InvoiceComputationResult(List<InvoiceLine> lines,
                                    InvoiceTotals totals,
                                    List<String> warnings,
                                    Long customerId,
                                    String customerName,
                                    Long invoiceId) {
        this.lines = List.copyOf(lines);
        this.totals = totals;
        this.warnings = List.copyOf(warnings);
        this.customerId = customerId;
        this.customerName = customerName;
        this.invoiceId = invoiceId;
    }

    public BigDecimal getSubTotal() { return totals.getSubTotal(); }
    public BigDecimal getVatTotal() { return totals.getVatTotal(); }
    public BigDecimal getGrandTotal() { return totals.getGrandTotal(); }
}
