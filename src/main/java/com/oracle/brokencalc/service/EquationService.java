package com.oracle.brokencalc.service;

import com.oracle.brokencalc.config.CalculatorConfig;
import com.oracle.brokencalc.core.EquationValidator;
import com.oracle.brokencalc.core.EquivalenceComparator;
import com.oracle.brokencalc.core.expr.ExpressionException;
import com.oracle.brokencalc.core.expr.ExpressionNode;
import com.oracle.brokencalc.core.expr.ExpressionParser;
import com.oracle.brokencalc.core.expr.ExpressionSyntaxException;
import com.oracle.brokencalc.core.expr.NodeKind;
import com.oracle.brokencalc.core.expr.SafeEvaluator;
import com.oracle.brokencalc.core.expr.SignatureExtractor;
import com.oracle.brokencalc.model.EquationSignature;
import com.oracle.brokencalc.model.SignatureReport;
import com.oracle.brokencalc.model.UniquenessResponse;
import com.oracle.brokencalc.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class EquationService {

    private final EquationValidator equationValidator;
    private final EquivalenceComparator equivalenceComparator;
    private final CalculatorConfig calculatorConfig;
    private final SignatureExtractor signatureExtractor = new SignatureExtractor();
    private final SafeEvaluator evaluator = new SafeEvaluator();

    public ValidationResult validate(String equation, int target) {
        ValidationResult result = equationValidator.validate(equation, target);
        log.debug("Validated '{}' against {}: valid={}, error={}", equation, target, result.isValid(), result.getErrorType());
        return result;
    }

    public boolean areEquivalent(String first, String second) {
        return equivalenceComparator.areEquivalent(first, second);
    }

    /**
     * First accepted equation that the candidate duplicates.
     */
    public Optional<String> findEquivalent(String candidate, List<String> accepted) {
        if (accepted == null) {
            return Optional.empty();
        }
        return accepted.stream()
                .filter(existing -> existing != null && equivalenceComparator.areEquivalent(candidate, existing))
                .findFirst();
    }

    public UniquenessResponse checkUniqueness(String candidate, List<String> accepted) {
        Optional<String> conflict = findEquivalent(candidate, accepted);
        conflict.ifPresent(existing -> log.debug("'{}' duplicates accepted equation '{}'", candidate, existing));
        return UniquenessResponse.builder()
                .candidate(candidate)
                .unique(conflict.isEmpty())
                .conflictsWith(conflict.orElse(null))
                .acceptedCount(accepted == null ? 0 : accepted.size())
                .equationsPerRound(calculatorConfig.getEquationsPerRound())
                .build();
    }

    public SignatureReport signature(String equation) {
        ExpressionNode root;
        try {
            root = ExpressionParser.parse(equation);
        } catch (ExpressionSyntaxException e) {
            log.debug("No signature for '{}': {}", equation, e.getMessage());
            return SignatureReport.builder()
                    .equation(equation)
                    .parsed(false)
                    .canonicalForm("")
                    .build();
        }

        EquationSignature signature = signatureExtractor.extract(root);
        SignatureReport report = SignatureReport.builder()
                .equation(equation)
                .parsed(true)
                .canonicalForm(signature.getCanonicalForm())
                .numericalValue(evaluateQuietly(root))
                .build();
        for (Map.Entry<BigDecimal, Integer> operand : signature.getOperands().entrySet()) {
            report.getOperands().put(operand.getKey().toPlainString(), operand.getValue());
        }
        for (Map.Entry<NodeKind, Integer> operator : signature.getOperators().entrySet()) {
            report.getOperators().put(operator.getKey().name().toLowerCase(Locale.ROOT), operator.getValue());
        }
        return report;
    }

    private Double evaluateQuietly(ExpressionNode root) {
        try {
            return evaluator.evaluate(root);
        } catch (ExpressionException e) {
            log.debug("Signature without value: {}", e.getMessage());
            return null;
        }
    }
}
