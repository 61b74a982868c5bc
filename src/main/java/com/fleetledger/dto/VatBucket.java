package com.fleetledger.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/** Sum of line totals at one VAT rate, and the VAT owed on it. */
@Getter
@EqualsAndHashCode
@ToString
public final class VatBucket {

    private final BigDecimal rate;
    private final BigDecimal base;
    private final BigDecimal vat;

    public VatBucket(BigDecimal rate, BigDecimal base, BigDecimal vat) {
        this.rate = rate;
        this.base = base;
        this.vat = vat;
    }
}
