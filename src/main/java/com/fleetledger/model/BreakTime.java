package com.fleetledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.Setter;

@Embeddable
@Getter
@Setter
public class BreakTime {

    @Column(name = "break_hour")
    private int hour;

    @Column(name = "break_minute")
    private int minute;

    public BreakTime() {}

    public BreakTime(int hour, int minute) {
        this.hour = hour;
        this.minute = minute;
    }

    public static BreakTime none() {
        return new BreakTime(0, 0);
    }

    public int totalMinutes() {
        return hour * 60 + minute;
    }
}
