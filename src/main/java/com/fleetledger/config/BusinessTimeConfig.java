package com.fleetledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Clock in the fleet's business time zone ({@code app.business.zone}). Invoice dates, due
 * dates and creation timestamps are taken from it.
 */
@Slf4j
@Configuration
public class BusinessTimeConfig {

    static final String DEFAULT_ZONE = "Europe/Amsterdam";

    @Bean
    public Clock businessClock(@Value("${app.business.zone:" + DEFAULT_ZONE + "}") String zone) {
        ZoneId zoneId = businessZone(zone);
        log.info("Business time zone: {}", zoneId);
        return Clock.system(zoneId);
    }

    static ZoneId businessZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneId.of(DEFAULT_ZONE);
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException ex) {
            throw new IllegalStateException("Invalid app.business.zone '" + zone + "'", ex);
        }
    }
}
