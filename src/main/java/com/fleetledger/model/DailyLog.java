package com.fleetledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "daily_logs")
@Getter
@Setter
public class DailyLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "weekly_log_id")
    private WeeklyLog weeklyLog;

    @Column(nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DayStatus status;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Embedded
    private BreakTime breakTime;

    // Odometer readings; upstream does not guarantee end >= start
    @Column(name = "start_mileage")
    private Integer startMileage;

    @Column(name = "end_mileage")
    private Integer endMileage;

    @Convert(converter = TollConverter.class)
    private Toll toll = Toll.NONE;

    @Column(name = "license_plate")
    private String licensePlate;

    @Column(name = "overnight_stay")
    private boolean overnightStay;

    @Column(name = "trip_number", length = 1000)
    private String tripNumber;
}
