package com.example.khaznati_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({StorageProperties.class, CorsProperties.class})
public class AppConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
