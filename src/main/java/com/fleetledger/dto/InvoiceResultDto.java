package com.fleetledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON view of a computed invoice. Amounts are kept exact internally and only rounded to
 * cents here.
 */
public class InvoiceResultDto {

    private final List<LineDto> lines;
    private final List<VatDto> vatBreakdown;
    private final BigDecimal subTotal;
    private final BigDecimal vatTotal;
    private final BigDecimal grandTotal;
    private final List<String> warnings;
    private final Long customerId;
    private final String customerName;
    private final Long invoiceId;

    public InvoiceResultDto(InvoiceComputationResult result, List<String> extraWarnings) {
        this.lines = result.getLines().stream().map(LineDto::new).collect(Collectors.toList());
        this.vatBreakdown = result.getTotals().getVatBreakdown().stream().map(VatDto::new).collect(Collectors.toList());
        this.subTotal = result.getSubTotal();
        this.vatTotal = result.getVatTotal();
        this.grandTotal = result.getGrandTotal();
        List<String> all = new ArrayList<>(extraWarnings);
        all.addAll(result.getWarnings());
        this.warnings = all;
        this.customerId = result.getCustomerId();
        this.customerName = result.getCustomerName();
        this.invoiceId = result.getInvoiceId();
    }

    public List<LineDto> getLines() { return lines; }
    public List<VatDto> getVatBreakdown() { return vatBreakdown; }
    public List<String> getWarnings() { return warnings; }
    public Long getCustomerId() { return customerId; }
    public String getCustomerName() { return customerName; }
    public Long getInvoiceId() { return invoiceId; }

    @JsonProperty("subTotal")
    public BigDecimal getSubTotal() { return cents(subTotal); }

    @JsonProperty("vatTotal")
    public BigDecimal getVatTotal() { return cents(vatTotal); }

    @JsonProperty("grandTotal")
    public BigDecimal getGrandTotal() { return cents(grandTotal); }

    static BigDecimal cents(BigDecimal amount) {
        return amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
    }

    /** Drops trailing zeros but keeps at least {@code minScale} decimals. */
    static BigDecimal trimmed(BigDecimal value, int minScale) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < minScale ? stripped.setScale(minScale) : stripped;
    }

    public static class LineDto {
        private final BigDecimal quantity;
        private final String description;
        private final BigDecimal unitPrice;
        private final BigDecimal vatRate;
        private final BigDecimal total;

        LineDto(InvoiceLine line) {
            this.quantity = line.getQuantity();
            this.description = line.getDescription();
            this.unitPrice = line.getUnitPrice();
            this.vatRate = line.getVatRate();
            this.total = line.getTotal();
        }

        // Hours carry six decimals internally
        @JsonProperty("quantity")
        public BigDecimal getQuantity() { return trimmed(quantity, 0); }

        public String getDescription() { return description; }

        // Unit prices such as 0.616 per km must not lose precision
        @JsonProperty("unitPrice")
        public BigDecimal getUnitPrice() { return trimmed(unitPrice, 2); }

        public BigDecimal getVatRate() { return vatRate; }

        @JsonProperty("total")
        public BigDecimal getTotal() { return cents(total); }
    }

    public static class VatDto {
        private final BigDecimal rate;
        private final BigDecimal base;
        private final BigDecimal vat;

        VatDto(VatBucket bucket) {
            this.rate = bucket.getRate();
            this.base = bucket.getBase();
            this.vat = bucket.getVat();
        }

        public BigDecimal getRate() { return rate; }

        @JsonProperty("base")
        public BigDecimal getBase() { return cents(base); }

        @JsonProperty("vat")
        public BigDecimal getVat() { return cents(vat); }
    }
}
