package com.pageanalytics.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    // Days are UTC calendar days everywhere
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
