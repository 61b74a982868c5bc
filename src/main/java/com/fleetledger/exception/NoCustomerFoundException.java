package com.fleetledger.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

/**
 * No customer could be determined for a weekly log: either no worked day carries a license
 * plate, or no customer has the majority plate assigned.
 */
@Getter
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class NoCustomerFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String weekId;

    private final List<String> licensePlates;

    public NoCustomerFoundException(String weekId, List<String> licensePlates) {
        super("Geen klant gevonden voor kenteken in weekstaat.");
        this.weekId = weekId;
        this.licensePlates = List.copyOf(licensePlates);
    }
}
