package com.noteshub.gamification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /**
     * All day-boundary and TTL decisions are made in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
