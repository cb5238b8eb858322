package com.oracle.brokencalc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class RandomConfig {

    /**
     * Source of randomness for broken-key selection. Tests and seeded requests
     * pass their own {@link Random} instead.
     */
    @Bean
    public Random brokenKeyRandom() {
        return new SecureRandom();
    }
}
