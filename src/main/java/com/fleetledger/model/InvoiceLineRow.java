package com.fleetledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Stored invoice line. Toll placeholders are the rows with zero quantity and price and a
 * description containing "tol"; toll reconciliation overwrites those in place.
 */
@Entity
@Getter
@Setter
@Table(name = "invoice_lines")
public class InvoiceLineRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "invoice_id")
    private Invoice invoice;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "quantity", nullable = false, precision = 14, scale = 6)
    private BigDecimal quantity;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "unit_price", nullable = false, precision = 16, scale = 6)
    private BigDecimal unitPrice;

    @Column(name = "vat_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal vatRate;

    @Column(name = "total", nullable = false, precision = 14, scale = 2)
    private BigDecimal total;
}
