package com.fleetledger;

import com.fleetledger.model.BillingType;
import com.fleetledger.model.BreakTime;
import com.fleetledger.model.Customer;
import com.fleetledger.model.DailyLog;
import com.fleetledger.model.DayStatus;
import com.fleetledger.model.MileageRateType;
import com.fleetledger.model.Toll;
import com.fleetledger.model.WeeklyLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/** Builders for weekly logs and customers shared by the tests. Week 2025-06 starts Monday 2025-02-03. */
public final class Fixtures {

    public static final String WEEK = "2025-06";
    public static final LocalDate MONDAY = LocalDate.of(2025, 2, 3);
    public static final LocalDate SATURDAY = MONDAY.plusDays(5);
    public static final LocalDate SUNDAY = MONDAY.plusDays(6);

    private Fixtures() {}

    public static WeeklyLog weeklyLog(String driverId, DailyLog... days) {
        WeeklyLog weeklyLog = new WeeklyLog();
        weeklyLog.setWeekId(WEEK);
        weeklyLog.setDriverId(driverId);
        for (DailyLog day : days) {
            weeklyLog.addDay(day);
        }
        return weeklyLog;
    }

    /** Worked day 08:00-16:00 with a 30 minute break, no kilometers. */
    public static DailyLog workedDay(LocalDate date, String plate) {
        DailyLog day = new DailyLog();
        day.setDate(date);
        day.setStatus(DayStatus.WORKED);
        day.setStartTime(LocalTime.of(8, 0));
        day.setEndTime(LocalTime.of(16, 0));
        day.setBreakTime(new BreakTime(0, 30));
        day.setLicensePlate(plate);
        day.setToll(Toll.NONE);
        return day;
    }

    public static DailyLog dayWithStatus(LocalDate date, DayStatus status, String plate) {
        DailyLog day = workedDay(date, plate);
        day.setStatus(status);
        return day;
    }

    public static DailyLog mileage(DailyLog day, int start, int end) {
        day.setStartMileage(start);
        day.setEndMileage(end);
        return day;
    }

    public static Customer customer(String name, BillingType billingType, String... plates) {
        Customer customer = new Customer();
        customer.setCompanyName(name);
        customer.setBillingType(billingType);
        customer.setAssignedLicensePlates(new ArrayList<>(List.of(plates)));
        return customer;
    }

    public static Customer hourlyCustomer(String rate) {
        Customer customer = customer("Uurklant BV", BillingType.HOURLY);
        customer.setHourlyRate(new BigDecimal(rate));
        return customer;
    }

    public static Customer mileageCustomer(MileageRateType type, String rate) {
        Customer customer = customer("Kilometerklant BV", BillingType.MILEAGE);
        customer.setMileageRateType(type);
        customer.setMileageRate(rate == null ? null : new BigDecimal(rate));
        return customer;
    }
}
