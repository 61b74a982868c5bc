package com.fleetledger.dto;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Getter
@ToString
public final class InvoiceTotals {

    private final BigDecimal subTotal;
    private final List<VatBucket> vatBreakdown; // ascending by rate
    private final BigDecimal vatTotal;
    private final BigDecimal grandTotal;

    public InvoiceTotals(BigDecimal subTotal, List<VatBucket> vatBreakdown, BigDecimal vatTotal, BigDecimal grandTotal) {
        this.subTotal = subTotal;
        this.vatBreakdown = List.copyOf(vatBreakdown);
        this.vatTotal = vatTotal;
        this.grandTotal = grandTotal;
    }

    public Optional<VatBucket> bucketFor(BigDecimal rate) {
        return vatBreakdown.stream()
                .filter(b -> b.getRate().compareTo(rate) == 0)
                .findFirst();
    }
}
