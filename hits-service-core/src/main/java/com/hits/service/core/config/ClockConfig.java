package com.hits.service.core.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Source of "now" for hit timestamps and aggregate range ends. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock hitsClock() {
        return Clock.systemUTC();
    }
}
