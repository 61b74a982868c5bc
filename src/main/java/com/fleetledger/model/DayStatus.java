package com.fleetledger.model;

/**
 * Status of a single day in a driver's weekly log. Only {@link #WORKED} is billable.
 */
public enum DayStatus {
    WORKED,
    SICK,
    VACATION,
    PARENTAL_LEAVE,
    WEEKEND,
    HOLIDAY,
    ATV,
    PERSONAL_LEAVE,
    UNPAID_LEAVE,
    COURSE;

    public boolean isBillable() {
        return this == WORKED;
    }
}
