package com.oracle.brokencalc.core;

import com.oracle.brokencalc.model.ValidationResult;

public interface EquationValidator {

    /**
     * Parse, evaluate and compare an equation against the round's target.
     * Never throws for bad input; every failure is reported in the result.
     *
     * @param equation  text typed by the player
     * @param target    the round's target number
     * @return          the structured outcome
     */
    ValidationResult validate(String equation, int target);
}
