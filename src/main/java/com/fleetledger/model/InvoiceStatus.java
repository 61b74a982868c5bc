package com.fleetledger.model;

// Only CONCEPT is set here; the rest belongs to the invoice lifecycle outside the engine.
public enum InvoiceStatus {
    CONCEPT,
    OPEN,
    PAID,
    CREDIT
}
