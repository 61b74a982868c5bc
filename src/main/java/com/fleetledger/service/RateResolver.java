package com.fleetledger.service;

import com.fleetledger.config.InvoicingProperties;
import com.fleetledger.model.Customer;
import com.fleetledger.model.MileageRateType;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.DayOfWeek;

/**
 * Effective unit prices for an hour or a kilometer. Pure: the result depends only on the
 * customer's contract, the day and the weekly rate.
 */
@Service
public class RateResolver {

    private final InvoicingProperties properties;

    public RateResolver(InvoicingProperties properties) {
        this.properties = properties;
    }

    /**
     * Base hourly rate, multiplied by the weekend surcharge percentage on Saturday or Sunday.
     * Monday to Friday always get the base rate.
     */
    public BigDecimal resolveHourlyRate(Customer customer, DayOfWeek dayOfWeek) {
        BigDecimal base = baseHourlyRate(customer);
        if (dayOfWeek == DayOfWeek.SATURDAY && isPositive(customer.getSaturdaySurcharge())) {
            return base.multiply(percent(customer.getSaturdaySurcharge()));
        }
        if (dayOfWeek == DayOfWeek.SUNDAY && isPositive(customer.getSundaySurcharge())) {
            return base.multiply(percent(customer.getSundaySurcharge()));
        }
        return base;
    }

    /**
     * Per-kilometer price.
     * <ul>
     *   <li>FIXED: the customer's mileage rate.</li>
     *   <li>DOT: mileage rate * (1 + weeklyRate / 100).</li>
     *   <li>VARIABLE: the weekly rate itself.</li>
     * </ul>
     * DOT and VARIABLE fall back to the plain mileage rate when {@code weeklyRate} is null.
     */
    public BigDecimal resolveMileageRate(Customer customer, BigDecimal weeklyRate) {
        BigDecimal base = baseMileageRate(customer);
        switch (mileageRateType(customer)) {
            case DOT:
                return weeklyRate == null ? base : base.multiply(BigDecimal.ONE.add(weeklyRate.movePointLeft(2)));
            case VARIABLE:
                return weeklyRate == null ? base : weeklyRate;
            case FIXED:
            default:
                return base;
        }
    }

    public BigDecimal resolveOvernightRate(Customer customer) {
        return isPositive(customer.getOvernightRate()) ? customer.getOvernightRate() : properties.getDefaultOvernightRate();
    }

    public BigDecimal vatRate() {
        return properties.getVatRate();
    }

    // --- fallback checks (used for audit warnings) ---

    public boolean usesDefaultHourlyRate(Customer customer) {
        return !isPositive(customer.getHourlyRate());
    }

    public boolean usesDefaultMileageRate(Customer customer, BigDecimal weeklyRate) {
        if (mileageRateType(customer).needsWeeklyRate() && weeklyRate == null) return true;
        return mileageRateType(customer) != MileageRateType.VARIABLE && !isPositive(customer.getMileageRate());
    }

    public boolean usesDefaultOvernightRate(Customer customer) {
        return !isPositive(customer.getOvernightRate());
    }

    public static MileageRateType mileageRateType(Customer customer) {
        return customer.getMileageRateType() != null ? customer.getMileageRateType() : MileageRateType.FIXED;
    }

    /**
     * Weekly rate as received from outside. Blank or non-numeric input counts as absent.
     */
    public static BigDecimal parseWeeklyRate(String raw) {
        if (raw == null) return null;
        String v = raw.trim().replace(',', '.');
        if (!NumberUtils.isCreatable(v)) return null;
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            // hex/octal forms pass isCreatable but are not decimal rates
            return null;
        }
    }

    private BigDecimal baseHourlyRate(Customer customer) {
        return isPositive(customer.getHourlyRate()) ? customer.getHourlyRate() : properties.getDefaultHourlyRate();
    }

    private BigDecimal baseMileageRate(Customer customer) {
        return isPositive(customer.getMileageRate()) ? customer.getMileageRate() : properties.getDefaultMileageRate();
    }

    private static BigDecimal percent(Integer pct) {
        return BigDecimal.valueOf(pct).movePointLeft(2);
    }

    private static boolean isPositive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }

    private static boolean isPositive(Integer v) {
        return v != null && v > 0;
    }
}
