package com.repo.audit.analyzers;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;

import java.util.HashSet;
import java.util.Set;

/**
 * Halstead measures over a compilation unit's token stream.
 * Operators are keywords, operators and separators; operands are identifiers and literals.
 */
public final class HalsteadCalculator {

    private HalsteadCalculator() {
    }

    public record HalsteadMetrics(
            int distinctOperators,
            int distinctOperands,
            int totalOperators,
            int totalOperands) {

        public static final HalsteadMetrics EMPTY = new HalsteadMetrics(0, 0, 0, 0);

        public int vocabulary() {
            return distinctOperators + distinctOperands;
        }

        public int length() {
            return totalOperators + totalOperands;
        }

        public double volume() {
            int n = vocabulary();
            return n == 0 ? 0.0 : length() * (Math.log(n) / Math.log(2));
        }

        public double difficulty() {
            if (distinctOperands == 0)
                return 0.0;
            return (distinctOperators / 2.0) * ((double) totalOperands / distinctOperands);
        }

        public double effort() {
            return difficulty() * volume();
        }
    }

    public static HalsteadMetrics calculate(CompilationUnit cu) {
        if (cu.getTokenRange().isEmpty()) {
            return HalsteadMetrics.EMPTY;
        }

        Set<String> operators = new HashSet<>();
        Set<String> operands = new HashSet<>();
        int totalOperators = 0;
        int totalOperands = 0;

        for (JavaToken token : cu.getTokenRange().get()) {
            JavaToken.Category category = token.getCategory();
            if (category.isKeyword() || category.isOperator() || category.isSeparator()) {
                operators.add(token.getText());
                totalOperators++;
            } else if (category.isIdentifier() || category.isLiteral()) {
                operands.add(token.getText());
                totalOperands++;
            }
        }

        return new HalsteadMetrics(operators.size(), operands.size(), totalOperators, totalOperands);
    }
}
