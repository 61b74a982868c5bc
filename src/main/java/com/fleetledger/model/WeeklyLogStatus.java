package com.fleetledger.model;

public enum WeeklyLogStatus {
    CONCEPT,
    PENDING,
    APPROVED
}
