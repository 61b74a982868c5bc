package com.fleetledger.model;

import java.util.Arrays;
import java.util.List;

/**
 * Toll roads driven on a day. Belgium and Germany each get a zero-priced placeholder line
 * that toll reconciliation fills in later; other countries produce no line.
 */
public enum Toll {
    NONE("Geen"),
    BE("BE", "Tol België"),
    DE("DE", "Tol Duitsland"),
    BE_DE("BE/DE", "Tol België", "Tol Duitsland"),
    // recorded for the driver's administration, not reconciled
    FR("FR"),
    CH("CH"),
    AT("AT");

    private final String code;
    private final List<String> placeholderLabels;

    Toll(String code, String... placeholderLabels) {
        this.code = code;
        this.placeholderLabels = List.of(placeholderLabels);
    }

    public String getCode() { return code; }

    public List<String> getPlaceholderLabels() { return placeholderLabels; }

    /** Accepts both the enum name and the driver-facing code ("BE/DE", "Geen"); blank means none. */
    public static Toll fromCode(String value) {
        if (value == null || value.isBlank()) return NONE;
        String v = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown toll code: " + value));
    }
}
