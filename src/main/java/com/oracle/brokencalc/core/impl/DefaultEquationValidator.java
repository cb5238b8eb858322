package com.oracle.brokencalc.core.impl;

import com.oracle.brokencalc.config.CalculatorConfig;
import com.oracle.brokencalc.core.EquationValidator;
import com.oracle.brokencalc.core.expr.DivisionByZeroException;
import com.oracle.brokencalc.core.expr.ExpressionEvaluationException;
import com.oracle.brokencalc.core.expr.ExpressionNode;
import com.oracle.brokencalc.core.expr.ExpressionParser;
import com.oracle.brokencalc.core.expr.ExpressionSyntaxException;
import com.oracle.brokencalc.core.expr.SafeEvaluator;
import com.oracle.brokencalc.model.ValidationError;
import com.oracle.brokencalc.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class DefaultEquationValidator implements EquationValidator {

    private static final Pattern ILLEGAL_CHARACTER = Pattern.compile("[^0-9+\\-*/().\\s]");

    // '+' first in the text or first after '(', ignoring whitespace
    private static final Pattern UNARY_PLUS = Pattern.compile("(^|\\()\\s*\\+");

    private final CalculatorConfig calculatorConfig;
    private final SafeEvaluator evaluator = new SafeEvaluator();

    @Override
    public ValidationResult validate(String equation, int target) {
        String text = equation == null ? "" : equation.trim();
        if (text.isEmpty()) {
            return reject(ValidationError.EMPTY_EQUATION, "Equation is empty");
        }
        if (ILLEGAL_CHARACTER.matcher(text).find()) {
            return reject(ValidationError.ILLEGAL_CHARACTER, "Invalid characters in equation");
        }
        if (UNARY_PLUS.matcher(text).find()) {
            return reject(ValidationError.UNARY_PLUS_NOT_ALLOWED, "Unary plus is not allowed");
        }

        ExpressionNode root;
        try {
            root = ExpressionParser.parse(text);
        } catch (ExpressionSyntaxException e) {
            return reject(ValidationError.SYNTAX_ERROR, "Syntax error: " + e.getMessage());
        }

        double value;
        try {
            value = evaluator.evaluate(root);
        } catch (DivisionByZeroException e) {
            return reject(ValidationError.DIVISION_BY_ZERO, "Division by zero");
        } catch (ExpressionEvaluationException e) {
            return reject(ValidationError.INVALID_EQUATION, "Invalid equation: " + e.getMessage());
        }

        if (matchesTarget(value, target)) {
            log.debug("Equation '{}' equals target {}", text, target);
            return ValidationResult.success(value);
        }
        String message = String.format(Locale.ROOT, "Result is %.2f, not %d", value, target);
        log.debug("Equation '{}' rejected: {}", text, message);
        return ValidationResult.failure(ValidationError.VALUE_MISMATCH, message, value);
    }

    boolean matchesTarget(double value, int target) {
        double difference = Math.abs(value - target);
        double scale = Math.max(Math.abs(value), Math.abs((double) target));
        return difference <= Math.max(calculatorConfig.getRelativeTolerance() * scale,
                calculatorConfig.getAbsoluteTolerance());
    }

    private ValidationResult reject(ValidationError type, String message) {
        log.debug("Equation rejected ({}): {}", type, message);
        return ValidationResult.failure(type, message);
    }
}
