package com.shieldops.anomaly.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnomalyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
