package com.fleetledger.service;

import com.fleetledger.exception.InvoicePersistenceException;
import com.fleetledger.model.Invoice;
import com.fleetledger.repository.InvoiceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores an invoice header together with its lines. Lines cascade from the header, so both
 * are written in one transaction: a failing line insert leaves no header behind.
 */
@Slf4j
@Service
public class InvoicePersistenceService {

    private final InvoiceRepository invoiceRepository;

    public InvoicePersistenceService(InvoiceRepository invoiceRepository) {
        this.invoiceRepository = invoiceRepository;
    }

    @Transactional
    public Invoice save(Invoice invoice) {
        try {
            // flush here so constraint violations surface inside this method, not at commit
            Invoice saved = invoiceRepository.saveAndFlush(invoice);
            log.info("Stored concept invoice {} for customer {} with {} lines",
                    saved.getId(), saved.getCustomer().getId(), saved.getLines().size());
            return saved;
        } catch (DataAccessException e) {
            throw new InvoicePersistenceException(e.getMostSpecificCause().getMessage(), e);
        }
    }
}
