package com.oracle.brokencalc.service;

import com.oracle.brokencalc.core.BrokenKeyGenerator;
import com.oracle.brokencalc.model.BrokenKeysResponse;
import com.oracle.brokencalc.model.CalculatorKey;
import com.oracle.brokencalc.model.SolvabilityResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class BrokenKeyService {

    private final BrokenKeyGenerator brokenKeyGenerator;

    public BrokenKeysResponse generate(int target, int count, Long seed) {
        Set<CalculatorKey> broken = seed != null
                ? brokenKeyGenerator.generate(target, count, new Random(seed))
                : brokenKeyGenerator.generate(target, count);
        log.info("Round for target {}: {} of {} requested key(s) broken", target, broken.size(), count);

        return BrokenKeysResponse.builder()
                .target(target)
                .requestedCount(count)
                .brokenKeys(broken)
                .requiredWorking(brokenKeyGenerator.requiredWorking(target))
                .build();
    }

    public SolvabilityResponse checkSolvable(int target, Collection<CalculatorKey> brokenKeys) {
        Collection<CalculatorKey> broken = brokenKeys == null ? List.of() : brokenKeys;
        return SolvabilityResponse.builder()
                .target(target)
                .solvable(brokenKeyGenerator.isSolvable(target, broken))
                .estimatedMax(brokenKeyGenerator.estimateMaxReachable(broken))
                .build();
    }
}
