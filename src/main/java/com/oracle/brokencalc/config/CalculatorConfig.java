package com.oracle.brokencalc.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "calculator")
@Data
public class CalculatorConfig {

    /**
     * Targets at or below this only need 1 and + to stay working
     */
    private int smallTargetThreshold = 50;

    /**
     * Attempts the broken-key generator makes before giving up on breaking keys
     */
    private int maxGenerationAttempts = 10;

    /**
     * Relative tolerance when comparing an equation's value to the target
     */
    private double relativeTolerance = 1e-9;

    /**
     * Absolute tolerance when comparing an equation's value to the target
     */
    private double absoluteTolerance = 1e-9;

    /**
     * Distinct equations a player must find per round
     */
    private int equationsPerRound = 5;
}
