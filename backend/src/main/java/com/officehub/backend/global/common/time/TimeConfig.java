package com.officehub.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides shared time-related beans so modules use a single UTC clock source
 * and agree on which zone a calendar day of the office is measured in.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId officeZone(@Value("${app.office-zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }
}
