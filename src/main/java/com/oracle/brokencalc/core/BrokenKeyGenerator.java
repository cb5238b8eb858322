package com.oracle.brokencalc.core;

import com.oracle.brokencalc.model.CalculatorKey;

import java.util.Collection;
import java.util.Random;
import java.util.Set;

public interface BrokenKeyGenerator {

    /**
     * Pick up to {@code count} keys to disable for a round, keeping the target
     * heuristically reachable. Falls back to fewer (possibly zero) keys rather
     * than failing.
     */
    Set<CalculatorKey> generate(int target, int count);

    /**
     * Same as {@link #generate(int, int)} with an explicit source of randomness.
     */
    Set<CalculatorKey> generate(int target, int count, Random random);

    /**
     * Keys that are never broken for this target.
     */
    Set<CalculatorKey> requiredWorking(int target);

    /**
     * Reachability heuristic: whether the target looks attainable with the given keys broken.
     */
    boolean isSolvable(int target, Collection<CalculatorKey> brokenKeys);

    /**
     * Loose upper bound on values reachable with the given keys broken,
     * or 0 when no digit or no operator remains.
     */
    long estimateMaxReachable(Collection<CalculatorKey> brokenKeys);
}
