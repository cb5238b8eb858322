package com.oracle.brokencalc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokenKeysResponse {

    private Integer target;

    private Integer requestedCount;

    @Builder.Default
    private Set<CalculatorKey> brokenKeys = new LinkedHashSet<>();

    @Builder.Default
    private Set<CalculatorKey> requiredWorking = new LinkedHashSet<>();
}
