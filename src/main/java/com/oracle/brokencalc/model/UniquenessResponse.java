package com.oracle.brokencalc.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UniquenessResponse {

    private String candidate;

    private boolean unique;

    /** First accepted equation the candidate duplicates, if any. */
    private String conflictsWith;

    private int acceptedCount;

    private int equationsPerRound;
}
