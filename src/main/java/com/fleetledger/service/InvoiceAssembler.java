package com.fleetledger.service;

import com.fleetledger.config.InvoicingProperties;
import com.fleetledger.dto.InvoiceComputationResult;
import com.fleetledger.dto.InvoiceCreationOptions;
import com.fleetledger.dto.InvoiceLine;
import com.fleetledger.dto.InvoiceTotals;
import com.fleetledger.model.Customer;
import com.fleetledger.model.Invoice;
import com.fleetledger.model.InvoiceLineRow;
import com.fleetledger.model.MileageRateType;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.model.WeeklyRate;
import com.fleetledger.repository.WeeklyRateRepository;
import com.fleetledger.util.WeekIds;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of invoice generation: resolves the customer and weekly rate, generates the
 * lines, totals them and, when asked, stores the result as a concept invoice.
 * <p>
 * Lookups run before generation, one after the other; the mileage price of DOT and VARIABLE
 * customers depends on the weekly rate.
 */
@Slf4j
@Service
public class InvoiceAssembler {

    private static final int MONEY_SCALE = 2;

    private final CustomerResolver customerResolver;
    private final WeeklyRateRepository weeklyRateRepository;
    private final LineItemGenerator lineItemGenerator;
    private final TotalsAggregator totalsAggregator;
    private final InvoicePersistenceService persistenceService;
    private final InvoicingProperties properties;
    private final Clock clock;

    public InvoiceAssembler(CustomerResolver customerResolver,
                            WeeklyRateRepository weeklyRateRepository,
                            LineItemGenerator lineItemGenerator,
                            TotalsAggregator totalsAggregator,
                            InvoicePersistenceService persistenceService,
                            InvoicingProperties properties,
                            Clock clock) {
        this.customerResolver = customerResolver;
        this.weeklyRateRepository = weeklyRateRepository;
        this.lineItemGenerator = lineItemGenerator;
        this.totalsAggregator = totalsAggregator;
        this.persistenceService = persistenceService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param customer   billed customer; null => resolved from the log's license plates
     * @param weeklyRate DOT percentage or VARIABLE price; null => looked up for (customer, week)
     * @throws com.fleetledger.exception.NoCustomerFoundException when no customer can be resolved
     * @throws com.fleetledger.exception.InvoicePersistenceException when storing fails
     */
    public InvoiceComputationResult createInvoice(WeeklyLog weeklyLog,
                                                  Customer customer,
                                                  BigDecimal weeklyRate,
                                                  InvoiceCreationOptions options) {
        Objects.requireNonNull(weeklyLog, "weeklyLog required");
        InvoiceCreationOptions opts = options != null ? options : InvoiceCreationOptions.preview();

        Customer billed = customer != null ? customer : customerResolver.resolveOrThrow(weeklyLog);

        Set<String> warnings = new LinkedHashSet<>();
        BigDecimal rate = weeklyRate != null ? weeklyRate : lookupWeeklyRate(billed, weeklyLog.getWeekId(), warnings);

        List<InvoiceLine> lines = lineItemGenerator.generate(weeklyLog, billed, rate, warnings);
        InvoiceTotals totals = totalsAggregator.aggregate(lines);

        if (!warnings.isEmpty()) {
            log.info("Week {} for customer {}: fallbacks applied {}", weeklyLog.getWeekId(), billed.getId(), warnings);
        }

        Long invoiceId = null;
        if (opts.isCreateInvoice()) {
            Invoice stored = persistenceService.save(buildInvoice(weeklyLog, billed, lines, totals, opts));
            invoiceId = stored.getId();
        }

        return new InvoiceComputationResult(lines, totals, new ArrayList<>(warnings),
                billed.getId(), billed.getCompanyName(), invoiceId);
    }

    private BigDecimal lookupWeeklyRate(Customer customer, String weekId, Set<String> warnings) {
        MileageRateType type = RateResolver.mileageRateType(customer);
        if (!type.needsWeeklyRate() || customer.getId() == null) {
            return null;
        }
        BigDecimal found = weeklyRateRepository.findByCustomerIdAndWeekId(customer.getId(), weekId)
                .map(WeeklyRate::getRate)
                .orElse(null);
        if (found == null) {
            log.warn("No weekly rate for customer {} in week {} ({}), base mileage rate applies",
                    customer.getId(), weekId, type);
            warnings.add("Geen weektarief gevonden voor week " + weekId + "; basis kilometertarief gebruikt.");
        }
        return found;
    }

    private Invoice buildInvoice(WeeklyLog weeklyLog, Customer customer, List<InvoiceLine> lines,
                                 InvoiceTotals totals, InvoiceCreationOptions opts) {
        LocalDate invoiceDate = opts.getInvoiceDate() != null ? opts.getInvoiceDate() : LocalDate.now(clock);
        int paymentTerm = customer.getPaymentTerm() != null
                ? customer.getPaymentTerm()
                : properties.getDefaultPaymentTermDays();

        Invoice invoice = new Invoice();
        invoice.setCustomer(customer);
        invoice.setInvoiceDate(invoiceDate);
        invoice.setDueDate(opts.getDueDate() != null ? opts.getDueDate() : invoiceDate.plusDays(paymentTerm));
        invoice.setReference(StringUtils.isNotBlank(opts.getReference()) ? opts.getReference() : defaultReference(weeklyLog));
        invoice.setFooterText(StringUtils.isNotBlank(opts.getFooterText()) ? opts.getFooterText() : properties.getFooterText());
        invoice.setSubTotal(money(totals.getSubTotal()));
        invoice.setVatTotal(money(totals.getVatTotal()));
        invoice.setGrandTotal(money(totals.getGrandTotal()));
        invoice.setShowDailyTotals(customer.isShowDailyTotals());
        invoice.setShowWeeklyTotals(customer.isShowWeeklyTotals());
        invoice.setShowWorkTimes(customer.isShowWorkTimes());
        invoice.setCreatedAt(LocalDateTime.now(clock));

        for (InvoiceLine line : lines) {
            InvoiceLineRow row = new InvoiceLineRow();
            row.setQuantity(line.getQuantity());
            row.setDescription(line.getDescription());
            row.setUnitPrice(line.getUnitPrice());
            row.setVatRate(line.getVatRate());
            row.setTotal(money(line.getTotal()));
            invoice.addLine(row);
        }
        return invoice;
    }

    /** "Week 07 - 2025 (AB-123-C)", the plate being the most used one over all days. */
    String defaultReference(WeeklyLog weeklyLog) {
        String plate = CustomerResolver.majorityPlate(weeklyLog.getDays(), false).orElse("");
        String weekId = weeklyLog.getWeekId();
        if (!WeekIds.isValid(weekId)) {
            return "Week " + weekId + " (" + plate + ")";
        }
        return String.format("Week %s - %d (%s)", WeekIds.paddedWeek(weekId), WeekIds.year(weekId), plate);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
