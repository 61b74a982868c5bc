package com.fleetledger.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class InvoicePersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvoicePersistenceException(String detail, Throwable cause) {
        super("Fout bij aanmaken factuur: " + detail, cause);
    }
}
