package com.oracle.brokencalc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Debug view of an equation's signature, keyed by literal text and operator name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureReport {

    private String equation;

    private boolean parsed;

    @Builder.Default
    private Map<String, Integer> operands = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> operators = new LinkedHashMap<>();

    private String canonicalForm;

    /** Absent when the equation cannot be evaluated. */
    private Double numericalValue;
}
