package com.oracle.brokencalc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of checking an equation against a target.
 * Valid results always carry a value; invalid ones always carry an error,
 * and carry the value too when it could be computed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    private boolean valid;

    private ValidationError errorType;

    private String error;

    private Double value;

    public static ValidationResult success(double value) {
        return ValidationResult.builder()
                .valid(true)
                .value(value)
                .build();
    }

    public static ValidationResult failure(ValidationError errorType, String error) {
        return failure(errorType, error, null);
    }

    public static ValidationResult failure(ValidationError errorType, String error, Double value) {
        return ValidationResult.builder()
                .valid(false)
                .errorType(errorType)
                .error(error)
                .value(value)
                .build();
    }
}
