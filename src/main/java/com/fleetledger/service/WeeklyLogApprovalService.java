package com.fleetledger.service;

import com.fleetledger.dto.ApprovalResultDto;
import com.fleetledger.dto.InvoiceComputationResult;
import com.fleetledger.dto.InvoiceCreationOptions;
import com.fleetledger.exception.InvalidStateException;
import com.fleetledger.exception.ResourceNotFoundException;
import com.fleetledger.model.Customer;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.model.WeeklyLogStatus;
import com.fleetledger.repository.WeeklyLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Approves a submitted weekly log and drafts the concept invoice for it.
 * <p>
 * Approval and invoice creation commit together: a failing invoice write leaves the log
 * unapproved.
 */
@Slf4j
@Service
public class WeeklyLogApprovalService {

    private final WeeklyLogRepository weeklyLogRepository;
    private final CustomerResolver customerResolver;
    private final InvoiceAssembler invoiceAssembler;

    public WeeklyLogApprovalService(WeeklyLogRepository weeklyLogRepository,
                                    CustomerResolver customerResolver,
                                    InvoiceAssembler invoiceAssembler) {
        this.weeklyLogRepository = weeklyLogRepository;
        this.customerResolver = customerResolver;
        this.invoiceAssembler = invoiceAssembler;
    }

    @Transactional
    public ApprovalResultDto approve(String weekId, String driverId) {
        WeeklyLog weeklyLog = weeklyLogRepository.findByWeekIdAndDriverId(weekId, driverId)
                .orElseThrow(() -> new ResourceNotFoundException("WeeklyLog", "weekId/driverId", weekId + "/" + driverId));

        if (weeklyLog.getStatus() == WeeklyLogStatus.APPROVED) {
            throw new InvalidStateException("Weekstaat is al goedgekeurd.");
        }

        weeklyLog.setStatus(WeeklyLogStatus.APPROVED);
        weeklyLogRepository.save(weeklyLog);
        log.info("Weekly log {} of driver {} approved", weekId, driverId);

        Optional<Customer> customer = customerResolver.resolve(weeklyLog);
        if (customer.isEmpty()) {
            List<String> plates = CustomerResolver.workedPlates(weeklyLog);
            log.warn("Approved week {} of driver {} without invoice, no customer for plates {}", weekId, driverId, plates);
            String message = "De weekstaat is goedgekeurd, maar er is geen klant gekoppeld aan de kentekens ("
                    + String.join(", ", plates) + "). Er is geen factuur aangemaakt.";
            return new ApprovalResultDto(weekId, driverId, true, null, null, message, List.of());
        }

        InvoiceComputationResult result = invoiceAssembler.createInvoice(
                weeklyLog, customer.get(), null, InvoiceCreationOptions.persist());
        log.info("Concept invoice {} created for customer {} from week {} of driver {}",
                result.getInvoiceId(), result.getCustomerId(), weekId, driverId);

        String message = "De weekstaat is goedgekeurd en een conceptfactuur is aangemaakt voor: "
                + result.getCustomerName();
        return new ApprovalResultDto(weekId, driverId, true, result.getInvoiceId(), result.getCustomerName(),
                message, result.getWarnings());
    }
}
