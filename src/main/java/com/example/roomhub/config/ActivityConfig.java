package com.example.roomhub.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ActivityProperties.class)
public class ActivityConfig {

    /** Wall clock shared by all activities (tests swap in their own). */
    @Bean
    public Clock activityClock() {
        return Clock.systemUTC();
    }
}
