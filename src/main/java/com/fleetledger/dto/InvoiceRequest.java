package com.fleetledger.dto;

import com.fleetledger.util.WeekIds;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

@Getter
@Setter
public class InvoiceRequest {

    @NotBlank
    @Pattern(regexp = WeekIds.PATTERN, message = "must look like YYYY-WW")
    private String weekId;

    @NotBlank
    private String driverId;

    // null => resolved from the license plates in the log
    private Long customerId;

    // Free text as typed in the back office, "1,5" and "1.5" both accepted
    private String weeklyRate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate invoiceDate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dueDate;

    private String reference;

    private String footerText;
}
