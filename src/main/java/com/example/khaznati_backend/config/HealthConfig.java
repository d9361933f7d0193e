package com.example.khaznati_backend.config;

import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.ConnectionState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator storageBackendHealth(ObjectBackend backend) {
        return () -> {
            ConnectionState state = backend.connectionState();
            // the connection is lazy, so "not connected yet" is not a failure
            Health.Builder builder = state == ConnectionState.CONNECTED ? Health.up() : Health.unknown();
            return builder
                    .withDetail("backend", backend.name())
                    .withDetail("connection", state.name())
                    .build();
        };
    }
}
