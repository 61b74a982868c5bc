package com.fleetledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Fallback rates and invoice defaults, bound from {@code app.invoicing.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.invoicing")
public class InvoicingProperties {

    /** Used when a customer has no hourly rate (or zero). */
    private BigDecimal defaultHourlyRate = new BigDecimal("46.43");

    /** Used when a customer has no mileage rate, and for DOT/VARIABLE without a weekly rate. */
    private BigDecimal defaultMileageRate = new BigDecimal("0.56");

    private BigDecimal defaultOvernightRate = new BigDecimal("50");

    /** Applied to every generated line. */
    private BigDecimal vatRate = new BigDecimal("21");

    private int defaultPaymentTermDays = 30;

    private String footerText = "We verzoeken u vriendelijk het bovenstaande bedrag voor de vervaldatum "
            + "te voldoen op onze bankrekening onder vermelding van het factuurnummer.";
}
