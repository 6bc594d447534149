package com.NutriCare.diet_backend.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.util.TimeZone;

/**
 * Meal plans are filtered by calendar day, so "today" has to mean the hospital's day,
 * not the server's.
 */
@Slf4j
@Configuration
public class TimezoneConfig {

    private final ZoneId zoneId;

    public TimezoneConfig(@Value("${app.timezone:Asia/Kolkata}") String timezone) {
        this.zoneId = ZoneId.of(timezone);
    }

    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(zoneId));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }

    @Bean
    public Clock clock() {
        return Clock.system(zoneId);
    }
}
