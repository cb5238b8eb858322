package com.oracle.brokencalc.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolvabilityRequest {

    @NotNull(message = "Target is required")
    private Integer target;

    @Builder.Default
    private List<CalculatorKey> brokenKeys = new ArrayList<>();
}
