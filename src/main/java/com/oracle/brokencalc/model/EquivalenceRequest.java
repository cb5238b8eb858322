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
public class EquivalenceRequest {

    @NotNull(message = "First equation is required")
    private String first;

    @NotNull(message = "Second equation is required")
    private String second;
}
