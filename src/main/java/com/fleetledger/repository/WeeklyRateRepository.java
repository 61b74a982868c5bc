package com.fleetledger.repository;

import com.fleetledger.model.WeeklyRate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WeeklyRateRepository extends JpaRepository<WeeklyRate, Long> {
    Optional<WeeklyRate> findByCustomerIdAndWeekId(Long customerId, String weekId);
}
