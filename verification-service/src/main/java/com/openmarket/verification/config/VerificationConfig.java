package com.openmarket.verification.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(VerificationProperties.class)
public class VerificationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
