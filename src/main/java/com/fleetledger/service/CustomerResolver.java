package com.fleetledger.service;

import com.fleetledger.exception.NoCustomerFoundException;
import com.fleetledger.model.Customer;
import com.fleetledger.model.DailyLog;
import com.fleetledger.model.WeeklyLog;
import com.fleetledger.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the customer a weekly log is billed to from the license plates the driver used.
 */
@Slf4j
@Service
public class CustomerResolver {

    private final CustomerRepository customerRepository;

    public CustomerResolver(CustomerRepository customerRepository) {
        this.customerRepository = customerRepository;
    }

    /**
     * Majority plate over the worked days, matched against the customers' assigned plates.
     */
    public Optional<Customer> resolve(WeeklyLog weeklyLog) {
        Optional<String> plate = majorityPlate(weeklyLog.getDays(), true);
        if (plate.isEmpty()) {
            log.info("Week {} of driver {} has no worked day with a license plate",
                    weeklyLog.getWeekId(), weeklyLog.getDriverId());
            return Optional.empty();
        }
        List<Customer> owners = customerRepository.findByAssignedLicensePlate(plate.get());
        if (owners.size() > 1) {
            log.warn("Plate {} is assigned to {} customers, using customer {}",
                    plate.get(), owners.size(), owners.get(0).getId());
        }
        return owners.stream().findFirst();
    }

    public Customer resolveOrThrow(WeeklyLog weeklyLog) {
        return resolve(weeklyLog)
                .orElseThrow(() -> new NoCustomerFoundException(weeklyLog.getWeekId(), workedPlates(weeklyLog)));
    }

    /** Distinct plates of the worked days, in log order. */
    public static List<String> workedPlates(WeeklyLog weeklyLog) {
        return List.copyOf(plateCounts(weeklyLog.getDays(), true).keySet());
    }

    /**
     * Most used plate. On a tie the plate that appears first in the log wins.
     *
     * @param workedOnly count only days with a billable status
     */
    public static Optional<String> majorityPlate(List<DailyLog> days, boolean workedOnly) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : plateCounts(days, workedOnly).entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static Map<String, Integer> plateCounts(List<DailyLog> days, boolean workedOnly) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DailyLog day : days) {
            if (StringUtils.isBlank(day.getLicensePlate())) continue;
            if (workedOnly && (day.getStatus() == null || !day.getStatus().isBillable())) continue;
            counts.merge(day.getLicensePlate().trim(), 1, Integer::sum);
        }
        return counts;
    }
}
