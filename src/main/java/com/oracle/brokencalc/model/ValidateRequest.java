package com.oracle.brokencalc.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateRequest {

    @NotNull(message = "Equation is required")
    private String equation;

    @NotNull(message = "Target is required")
    private Integer target;
}
