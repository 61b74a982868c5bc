package com.fleetledger.service;

import com.fleetledger.dto.InvoiceComputationResult;
import com.fleetledger.dto.InvoiceCreationOptions;
import com.fleetledger.dto.InvoiceRequest;
import com.fleetledger.dto.InvoiceResultDto;
import com.fleetledger.exception.ResourceNotFoundException;
import com.fleetledger.model.Customer;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.repository.CustomerRepository;
import com.fleetledger.repository.WeeklyLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Back-office invoice requests: loads the weekly log and optional customer and runs the
 * assembler while the log's days are still attached.
 */
@Slf4j
@Service
public class InvoiceRequestService {

    private final WeeklyLogRepository weeklyLogRepository;
    private final CustomerRepository customerRepository;
    private final InvoiceAssembler invoiceAssembler;

    public InvoiceRequestService(WeeklyLogRepository weeklyLogRepository,
                                 CustomerRepository customerRepository,
                                 InvoiceAssembler invoiceAssembler) {
        this.weeklyLogRepository = weeklyLogRepository;
        this.customerRepository = customerRepository;
        this.invoiceAssembler = invoiceAssembler;
    }

    @Transactional(readOnly = true)
    public InvoiceResultDto preview(InvoiceRequest request) {
        return compute(request, options(request, false));
    }

    @Transactional
    public InvoiceResultDto create(InvoiceRequest request) {
        InvoiceResultDto dto = compute(request, options(request, true));
        log.info("Concept invoice {} created for week {} of driver {}",
                dto.getInvoiceId(), request.getWeekId(), request.getDriverId());
        return dto;
    }

    private InvoiceResultDto compute(InvoiceRequest request, InvoiceCreationOptions options) {
        WeeklyLog weeklyLog = weeklyLogRepository.findByWeekIdAndDriverId(request.getWeekId(), request.getDriverId())
                .orElseThrow(() -> new ResourceNotFoundException("WeeklyLog", "weekId/driverId",
                        request.getWeekId() + "/" + request.getDriverId()));

        Customer customer = null;
        if (request.getCustomerId() != null) {
            customer = customerRepository.findById(request.getCustomerId())
                    .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", request.getCustomerId()));
        }

        List<String> warnings = new ArrayList<>();
        BigDecimal weeklyRate = RateResolver.parseWeeklyRate(request.getWeeklyRate());
        if (weeklyRate == null && StringUtils.isNotBlank(request.getWeeklyRate())) {
            log.warn("Ignoring non-numeric weekly rate '{}' for week {}", request.getWeeklyRate(), request.getWeekId());
            warnings.add("Ongeldig weektarief genegeerd: " + request.getWeeklyRate().trim());
        }

        InvoiceComputationResult result = invoiceAssembler.createInvoice(weeklyLog, customer, weeklyRate, options);
        return new InvoiceResultDto(result, warnings);
    }

    private static InvoiceCreationOptions options(InvoiceRequest request, boolean persist) {
        InvoiceCreationOptions options = persist ? InvoiceCreationOptions.persist() : InvoiceCreationOptions.preview();
        options.setInvoiceDate(request.getInvoiceDate());
        options.setDueDate(request.getDueDate());
        options.setReference(request.getReference());
        options.setFooterText(request.getFooterText());
        return options;
    }
}
