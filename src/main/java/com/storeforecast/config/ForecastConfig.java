package com.storeforecast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ForecastConfig {

    @Bean
    public Clock forecastClock(ForecastProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
