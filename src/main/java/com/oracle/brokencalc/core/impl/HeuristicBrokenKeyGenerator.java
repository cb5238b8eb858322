package com.oracle.brokencalc.core.impl;

import com.oracle.brokencalc.config.CalculatorConfig;
import com.oracle.brokencalc.core.BrokenKeyGenerator;
import com.oracle.brokencalc.model.CalculatorKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Breaks random keys while a coarse reachability estimate still covers the
 * target. Each failed attempt retries with one key fewer; once the count or
 * the attempt budget runs out no keys are broken at all.
 * <p>
 * The estimate is deliberately loose: it only filters out rounds that are
 * obviously hopeless and does not prove an equation exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeuristicBrokenKeyGenerator implements BrokenKeyGenerator {

    private final CalculatorConfig calculatorConfig;
    private final Random brokenKeyRandom;

    @Override
    public Set<CalculatorKey> generate(int target, int count) {
        return generate(target, count, brokenKeyRandom);
    }

    @Override
    public Set<CalculatorKey> generate(int target, int count, Random random) {
        Set<CalculatorKey> required = requiredWorking(target);
        List<CalculatorKey> breakable = new ArrayList<>(EnumSet.complementOf(EnumSet.copyOf(required)));

        int remaining = count;
        int attempts = 0;
        while (remaining > 0 && attempts < calculatorConfig.getMaxGenerationAttempts()) {
            Set<CalculatorKey> broken = sample(breakable, Math.min(remaining, breakable.size()), random);
            if (isSolvable(target, broken)) {
                log.debug("Broke {} key(s) for target {} after {} failed attempt(s): {}",
                        broken.size(), target, attempts, broken);
                return broken;
            }
            log.debug("Target {} not reachable without {}, retrying with {} key(s)", target, broken, remaining - 1);
            remaining--;
            attempts++;
        }

        log.debug("No keys broken for target {} (requested {}, {} attempt(s) used)", target, count, attempts);
        return EnumSet.noneOf(CalculatorKey.class);
    }

    @Override
    public Set<CalculatorKey> requiredWorking(int target) {
        if (target <= calculatorConfig.getSmallTargetThreshold()) {
            return EnumSet.of(CalculatorKey.ONE, CalculatorKey.PLUS);
        }
        return EnumSet.of(CalculatorKey.TWO, CalculatorKey.MULTIPLY, CalculatorKey.PLUS);
    }

    @Override
    public boolean isSolvable(int target, Collection<CalculatorKey> brokenKeys) {
        List<Integer> digits = workingDigits(brokenKeys);
        Set<CalculatorKey> operators = workingOperators(brokenKeys);
        if (digits.isEmpty() || operators.isEmpty()) {
            return false;
        }
        return estimate(digits, operators) >= target;
    }

    @Override
    public long estimateMaxReachable(Collection<CalculatorKey> brokenKeys) {
        List<Integer> digits = workingDigits(brokenKeys);
        Set<CalculatorKey> operators = workingOperators(brokenKeys);
        if (digits.isEmpty() || operators.isEmpty()) {
            return 0;
        }
        return estimate(digits, operators);
    }

    private long estimate(List<Integer> digits, Set<CalculatorKey> operators) {
        long maxDigit = Collections.max(digits);
        long estimate = maxDigit * 10;

        if (operators.contains(CalculatorKey.PLUS)) {
            long sum = digits.stream().mapToLong(Integer::longValue).sum();
            estimate = Math.max(estimate, sum * 5);
        }
        if (operators.contains(CalculatorKey.MULTIPLY) && digits.size() >= 2) {
            estimate = Math.max(estimate, maxDigit * maxDigit);
        }
        return estimate;
    }

    private Set<CalculatorKey> sample(List<CalculatorKey> breakable, int size, Random random) {
        List<CalculatorKey> shuffled = new ArrayList<>(breakable);
        Collections.shuffle(shuffled, random);
        Set<CalculatorKey> picked = EnumSet.noneOf(CalculatorKey.class);
        picked.addAll(shuffled.subList(0, size));
        return picked;
    }

    private List<Integer> workingDigits(Collection<CalculatorKey> brokenKeys) {
        List<Integer> digits = new ArrayList<>();
        for (CalculatorKey key : CalculatorKey.values()) {
            if (key.isDigit() && !brokenKeys.contains(key)) {
                digits.add(key.digitValue());
            }
        }
        return digits;
    }

    private Set<CalculatorKey> workingOperators(Collection<CalculatorKey> brokenKeys) {
        Set<CalculatorKey> operators = EnumSet.noneOf(CalculatorKey.class);
        for (CalculatorKey key : CalculatorKey.values()) {
            if (key.isArithmeticOperator() && !brokenKeys.contains(key)) {
                operators.add(key);
            }
        }
        return operators;
    }
}
