package com.fleetledger.dto;

import lombok.Getter;

import java.util.List;

/**
 * Outcome of approving a weekly log. {@code invoiceId} stays null when no customer could be
 * linked to the plates; the message then says so.
 */
@Getter
public class ApprovalResultDto {

    private final String weekId;
    private final String driverId;
    private final boolean approved;
    private final Long invoiceId;
    private final String customerName;
    private final String message;
    private final List<String> warnings;

    public ApprovalResultDto(String weekId, String driverId, boolean approved, Long invoiceId,
                             String customerName, String message, List<String> warnings) {
        this.weekId = weekId;
        this.driverId = driverId;
        this.approved = approved;
        this.invoiceId = invoiceId;
        this.customerName = customerName;
        this.message = message;
        this.warnings = List.copyOf(warnings);
    }
}
