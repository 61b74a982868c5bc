package com.fleetledger.controller;

import com.fleetledger.dto.InvoiceRequest;
import com.fleetledger.dto.InvoiceResultDto;
import com.fleetledger.service.InvoiceRequestService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/invoices")
@PreAuthorize("hasRole('ADMIN')")
public class AdminInvoiceController {

    private final InvoiceRequestService invoiceRequestService;

    public AdminInvoiceController(InvoiceRequestService invoiceRequestService) {
        this.invoiceRequestService = invoiceRequestService;
    }

    // Lines and totals only, nothing is stored
    @PostMapping("/preview")
    public InvoiceResultDto preview(@Valid @RequestBody InvoiceRequest request) {
        return invoiceRequestService.preview(request);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public InvoiceResultDto create(@Valid @RequestBody InvoiceRequest request) {
        return invoiceRequestService.create(request);
    }
}
