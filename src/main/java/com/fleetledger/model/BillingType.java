package com.fleetledger.model;

public enum BillingType {
    HOURLY,
    MILEAGE,
    COMBINED;

    public boolean includesHours() {
        return this == HOURLY || this == COMBINED;
    }

    public boolean includesMileage() {
        return this == MILEAGE || this == COMBINED;
    }
}
