package com.fleetledger.service;

import com.fleetledger.dto.InvoiceLine;
import com.fleetledger.model.BillingType;
import com.fleetledger.model.BreakTime;
import com.fleetledger.model.Customer;
import com.fleetledger.model.DailyLog;
import com.fleetledger.model.Toll;
import com.fleetledger.model.WeeklyLog;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Turns a weekly log into invoice lines, one day at a time in log order.
 * <p>
 * Per worked day, in this order: kilometers, hours, overnight stay, toll placeholders.
 * Days with any other status produce nothing. The customer's daily expense allowance is
 * payroll data and never becomes a line.
 */
@Slf4j
@Service
public class LineItemGenerator {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);
    // hours are capped at 6 decimals; totals round to cents only on storage and in JSON
    private static final int HOURS_SCALE = 6;
    private static final int MINUTES_PER_DAY = 24 * 60;

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm");

    private static final Map<DayOfWeek, String> DAY_NAMES = new EnumMap<>(DayOfWeek.class);
    static {
        DAY_NAMES.put(DayOfWeek.MONDAY, "Maandag");
        DAY_NAMES.put(DayOfWeek.TUESDAY, "Dinsdag");
        DAY_NAMES.put(DayOfWeek.WEDNESDAY, "Woensdag");
        DAY_NAMES.put(DayOfWeek.THURSDAY, "Donderdag");
        DAY_NAMES.put(DayOfWeek.FRIDAY, "Vrijdag");
        DAY_NAMES.put(DayOfWeek.SATURDAY, "Zaterdag");
        DAY_NAMES.put(DayOfWeek.SUNDAY, "Zondag");
    }

    private final RateResolver rateResolver;

    public LineItemGenerator(RateResolver rateResolver) {
        this.rateResolver = rateResolver;
    }

    public List<InvoiceLine> generate(WeeklyLog weeklyLog, Customer customer, BigDecimal weeklyRate) {
        return generate(weeklyLog, customer, weeklyRate, new LinkedHashSet<>());
    }

    /**
     * Same as {@link #generate(WeeklyLog, Customer, BigDecimal)}, additionally recording every
     * fallback or data anomaly it runs into in {@code warnings}.
     */
    public List<InvoiceLine> generate(WeeklyLog weeklyLog, Customer customer, BigDecimal weeklyRate,
                                      Collection<String> warnings) {
        BillingType billingType = billingType(customer);
        BigDecimal vatRate = rateResolver.vatRate();
        List<InvoiceLine> lines = new ArrayList<>();

        for (DailyLog day : weeklyLog.getDays()) {
            if (day.getStatus() == null || !day.getStatus().isBillable()) {
                continue;
            }

            String label = dayLabel(day);
            String tripSuffix = tripSuffix(day);

            int kilometers = kilometers(day);
            if (billingType.includesMileage() && kilometers > 0) {
                BigDecimal price = rateResolver.resolveMileageRate(customer, weeklyRate);
                if (rateResolver.usesDefaultMileageRate(customer, weeklyRate)) {
                    warnings.add("Standaard kilometertarief toegepast: " + price.toPlainString());
                }
                lines.add(new InvoiceLine(BigDecimal.valueOf(kilometers),
                        label + "\nKilometers" + tripSuffix, price, vatRate));
            }

            if (billingType.includesHours()) {
                BigDecimal hours = workedHours(day, warnings);
                if (hours != null) {
                    BigDecimal price = rateResolver.resolveHourlyRate(customer, day.getDate().getDayOfWeek());
                    if (rateResolver.usesDefaultHourlyRate(customer)) {
                        warnings.add("Standaard uurtarief toegepast.");
                    }
                    lines.add(new InvoiceLine(hours, label + "\n" + hoursLabel(day, customer) + tripSuffix,
                            price, vatRate));
                }
            }

            if (day.isOvernightStay()) {
                if (rateResolver.usesDefaultOvernightRate(customer)) {
                    warnings.add("Standaard overnachtingstarief toegepast.");
                }
                lines.add(new InvoiceLine(BigDecimal.ONE, label + "\nOvernachting" + tripSuffix,
                        rateResolver.resolveOvernightRate(customer), vatRate));
            }

            Toll toll = day.getToll() != null ? day.getToll() : Toll.NONE;
            for (String tollLabel : toll.getPlaceholderLabels()) {
                lines.add(new InvoiceLine(BigDecimal.ZERO, label + "\n" + tollLabel + tripSuffix,
                        BigDecimal.ZERO, vatRate));
            }
        }
        return lines;
    }

    /** A missing billing type bills hours, plus kilometers when a mileage rate type is configured. */
    static BillingType billingType(Customer customer) {
        if (customer.getBillingType() != null) return customer.getBillingType();
        return customer.getMileageRateType() != null ? BillingType.COMBINED : BillingType.HOURLY;
    }

    static int kilometers(DailyLog day) {
        int start = day.getStartMileage() != null ? day.getStartMileage() : 0;
        int end = day.getEndMileage() != null ? day.getEndMileage() : 0;
        return Math.max(0, end - start);
    }

    /**
     * Worked hours = (end - start) - break. An end before the start is a shift past midnight
     * and rolls over to the next day. Returns null when no positive time is left.
     */
    private BigDecimal workedHours(DailyLog day, Collection<String> warnings) {
        LocalTime start = day.getStartTime();
        LocalTime end = day.getEndTime();
        if (start == null || end == null) {
            warnings.add(dayLabel(day) + ": geen begin- of eindtijd, geen uren gefactureerd.");
            return null;
        }

        int startMinutes = start.getHour() * 60 + start.getMinute();
        int endMinutes = end.getHour() * 60 + end.getMinute();
        if (endMinutes < startMinutes) {
            log.info("Shift on {} ends before it starts ({} - {}), treating as overnight", day.getDate(), start, end);
            endMinutes += MINUTES_PER_DAY;
        }

        int worked = endMinutes - startMinutes - breakOf(day).totalMinutes();
        if (worked <= 0) {
            log.warn("Non-positive worked time on {}: {} min", day.getDate(), worked);
            warnings.add(dayLabel(day) + ": gewerkte tijd is " + worked + " min, geen uren gefactureerd.");
            return null;
        }
        return BigDecimal.valueOf(worked).divide(MINUTES_PER_HOUR, HOURS_SCALE, RoundingMode.HALF_UP);
    }

    private static String hoursLabel(DailyLog day, Customer customer) {
        if (!customer.isShowWorkTimes()) {
            return "Uren";
        }
        return String.format("Uren (%s - %s, %d min pauze)",
                day.getStartTime().format(CLOCK),
                day.getEndTime().format(CLOCK),
                breakOf(day).totalMinutes());
    }

    static String dayLabel(DailyLog day) {
        return DAY_NAMES.get(day.getDate().getDayOfWeek()) + " " + day.getDate().format(DATE);
    }

    private static String tripSuffix(DailyLog day) {
        return StringUtils.isBlank(day.getTripNumber()) ? "" : " (Ritnr: " + day.getTripNumber().trim() + ")";
    }

    private static BreakTime breakOf(DailyLog day) {
        return day.getBreakTime() != null ? day.getBreakTime() : BreakTime.none();
    }
}
