package com.ai.clinicbot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /** Clinic-local clock; every "today" and "now" decision goes through it. */
    @Bean
    public Clock clock(@Value("${clinicbot.timezone:America/Tegucigalpa}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
