package com.fleetledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@Table(
        name = "weekly_logs",
        uniqueConstraints = @UniqueConstraint(columnNames = {"week_id", "driver_id"})
)
public class WeeklyLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "week_id", nullable = false, updatable = false)
    private String weekId; // "YYYY-WW"

    @Column(name = "driver_id", nullable = false)
    private String driverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private WeeklyLogStatus status = WeeklyLogStatus.CONCEPT;

    private String remarks;

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    @OneToMany(mappedBy = "weeklyLog", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("date ASC")
    private List<DailyLog> days = new ArrayList<>();

    public void addDay(DailyLog day) {
        day.setWeeklyLog(this);
        days.add(day);
    }
}
