package com.oracle.brokencalc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolvabilityResponse {

    private Integer target;

    private boolean solvable;

    /** Upper-bound estimate of reachable values; 0 when no digit or no operator works. */
    private long estimatedMax;
}
