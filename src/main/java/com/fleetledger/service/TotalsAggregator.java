package com.fleetledger.service;

import com.fleetledger.dto.InvoiceLine;
import com.fleetledger.dto.InvoiceTotals;
import com.fleetledger.dto.VatBucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Subtotal, VAT per rate and grand total over a set of lines. Nothing is rounded here;
 * rounding to cents happens when amounts are stored or shown.
 */
@Slf4j
@Service
public class TotalsAggregator {

    public InvoiceTotals aggregate(List<InvoiceLine> lines) {
        // TreeMap compares with compareTo, so 21 and 21.00 land in one bucket
        Map<BigDecimal, BigDecimal> baseByRate = new TreeMap<>();
        BigDecimal subTotal = BigDecimal.ZERO;

        for (InvoiceLine line : lines) {
            BigDecimal lineTotal = line.getQuantity().multiply(line.getUnitPrice());
            if (lineTotal.compareTo(line.getTotal()) != 0) {
                log.warn("Line total {} differs from quantity * unit price {} for '{}'",
                        line.getTotal(), lineTotal, line.getDescription());
            }
            subTotal = subTotal.add(lineTotal);
            baseByRate.merge(line.getVatRate(), lineTotal, BigDecimal::add);
        }

        List<VatBucket> buckets = new ArrayList<>();
        BigDecimal vatTotal = BigDecimal.ZERO;
        for (Map.Entry<BigDecimal, BigDecimal> e : baseByRate.entrySet()) {
            BigDecimal vat = e.getValue().multiply(e.getKey().movePointLeft(2));
            buckets.add(new VatBucket(e.getKey(), e.getValue(), vat));
            vatTotal = vatTotal.add(vat);
        }

        return new InvoiceTotals(subTotal, buckets, vatTotal, subTotal.add(vatTotal));
    }
}
