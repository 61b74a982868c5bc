package com.fleetledger.model;

/**
 * How the per-kilometer price is derived.
 * DOT adds a weekly diesel percentage on top of the base rate, VARIABLE takes the weekly
 * rate as the absolute price.
 */
public enum MileageRateType {
    FIXED,
    DOT,
    VARIABLE;

    public boolean needsWeeklyRate() {
        return this == DOT || this == VARIABLE;
    }
}
