package com.oracle.brokencalc.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrokenKeysRequest {

    @NotNull(message = "Target is required")
    private Integer target;

    @NotNull(message = "Count is required")
    @Min(value = 0, message = "Count cannot be negative")
    @Max(value = 16, message = "Count cannot exceed the number of keys")
    private Integer count;

    private Long seed; // fixed seed for reproducible rounds
}
