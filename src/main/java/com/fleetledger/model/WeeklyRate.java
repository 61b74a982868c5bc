package com.fleetledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Per-week rate for a customer: a diesel percentage for DOT customers, an absolute
 * per-kilometer price for VARIABLE customers.
 */
@Entity
@Getter
@Setter
@Table(
        name = "weekly_rates",
        uniqueConstraints = @UniqueConstraint(columnNames = {"week_id", "customer_id"})
)
public class WeeklyRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "week_id", nullable = false)
    private String weekId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "customer_id")
    private Customer customer;

    @Column(name = "rate", nullable = false, precision = 12, scale = 4)
    private BigDecimal rate;
}
