package com.oracle.brokencalc.core.expr;

import com.oracle.brokencalc.model.EquationSignature;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@RequiredArgsConstructor
public class SignatureExtractor {

    private final CanonicalFormGenerator canonicalFormGenerator;

    public SignatureExtractor() {
        this(new CanonicalFormGenerator());
    }

    /**
     * @return the signature, or empty if the text does not parse
     */
    public Optional<EquationSignature> extract(String text) {
        ExpressionNode root;
        try {
            root = ExpressionParser.parse(text);
        } catch (ExpressionSyntaxException e) {
            return Optional.empty();
        }
        return Optional.of(extract(root));
    }

    public EquationSignature extract(ExpressionNode root) {
        Map<BigDecimal, Integer> operands = new TreeMap<>();
        Map<NodeKind, Integer> operators = new EnumMap<>(NodeKind.class);
        collect(root, operands, operators);
        return new EquationSignature(
                Collections.unmodifiableMap(operands),
                Collections.unmodifiableMap(operators),
                canonicalFormGenerator.canonicalize(root));
    }

    private void collect(ExpressionNode node, Map<BigDecimal, Integer> operands, Map<NodeKind, Integer> operators) {
        if (node.getKind() == NodeKind.NUMBER) {
            operands.merge(node.getValue(), 1, Integer::sum);
            return;
        }
        operators.merge(node.getKind(), 1, Integer::sum);
        collect(node.getLeft(), operands, operators);
        if (node.getKind().isBinary()) {
            collect(node.getRight(), operands, operators);
        }
    }
}
