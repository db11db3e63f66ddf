package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({AssemblyProperties.class, CommitRetryProperties.class})
public class AssemblyConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
