package com.fleetledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "customers")
@Getter
@Setter
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_name", nullable = false)
    private String companyName;

    @Column(name = "payment_term")
    private Integer paymentTerm; // days, null => configured default

    @Column(name = "show_daily_totals")
    private boolean showDailyTotals;

    @Column(name = "show_weekly_totals")
    private boolean showWeeklyTotals;

    @Column(name = "show_work_times")
    private boolean showWorkTimes;

    // --- Billing contract ---
    @Enumerated(EnumType.STRING)
    @Column(name = "billing_type")
    private BillingType billingType;

    @Enumerated(EnumType.STRING)
    @Column(name = "mileage_rate_type")
    private MileageRateType mileageRateType;

    @Column(name = "hourly_rate", precision = 12, scale = 4)
    private BigDecimal hourlyRate;

    @Column(name = "mileage_rate", precision = 12, scale = 4)
    private BigDecimal mileageRate;

    @Column(name = "overnight_rate", precision = 12, scale = 2)
    private BigDecimal overnightRate;

    // Payroll only, never billed to the customer
    @Column(name = "daily_expense_allowance", precision = 12, scale = 2)
    private BigDecimal dailyExpenseAllowance;

    // Percent of base, e.g. 120 => 120%
    @Column(name = "saturday_surcharge")
    private Integer saturdaySurcharge;

    @Column(name = "sunday_surcharge")
    private Integer sundaySurcharge;

    @ElementCollection
    @CollectionTable(name = "customer_license_plates", joinColumns = @JoinColumn(name = "customer_id"))
    @Column(name = "license_plate")
    private List<String> assignedLicensePlates = new ArrayList<>();
}
