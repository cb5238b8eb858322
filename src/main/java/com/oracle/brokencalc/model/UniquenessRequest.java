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
public class UniquenessRequest {

    @NotNull(message = "Candidate equation is required")
    private String candidate;

    /** Equations already accepted this round. */
    @Builder.Default
    private List<String> accepted = new ArrayList<>();
}
