package com.fleetledger.repository;

import com.fleetledger.model.WeeklyLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WeeklyLogRepository extends JpaRepository<WeeklyLog, Long> {
    Optional<WeeklyLog> findByWeekIdAndDriverId(String weekId, String driverId);
}
