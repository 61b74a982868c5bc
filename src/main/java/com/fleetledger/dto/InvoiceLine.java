package com.fleetledger.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * One generated invoice line. Immutable; {@code total} is always {@code quantity * unitPrice}
 * at full precision.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class InvoiceLine {

    private final BigDecimal quantity;
    private final String description;
    private final BigDecimal unitPrice;
    private final BigDecimal vatRate;
    private final BigDecimal total;

    public InvoiceLine(BigDecimal quantity, String description, BigDecimal unitPrice, BigDecimal vatRate) {
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.description = Objects.requireNonNull(description, "description");
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
        this.vatRate = Objects.requireNonNull(vatRate, "vatRate");
        this.total = quantity.multiply(unitPrice);
    }

    /** Zero-valued line waiting for toll reconciliation to fill in the real amount. */
    public boolean isTollPlaceholder() {
        return quantity.signum() == 0
                && unitPrice.signum() == 0
                && description.toLowerCase(Locale.ROOT).contains("tol");
    }
}
