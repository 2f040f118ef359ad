package com.repo.audit.analyzers;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.stmt.*;
import com.repo.audit.analyzers.HalsteadCalculator.HalsteadMetrics;
import com.repo.audit.core.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cyclomatic complexity per method, constructor and initializer block.
 * <p>
 * CC = 1 + decision points, where a decision point is an if, loop, catch,
 * ternary, short-circuit boolean operator or non-default case arm. Units are
 * methods, constructors (record compact constructors included), initializer
 * blocks, and field initializers that hold a lambda or a branch. Lambdas count
 * toward the unit that declares them; methods of local and anonymous classes
 * are units of their own.
 */
public class ComplexityAnalyzer {

    private final ParserConfiguration parserConfiguration;

    public ComplexityAnalyzer() {
        this.parserConfiguration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    /**
     * Outcome of analyzing one file. {@code parseError} is set when the
     * source is not valid Java; all other fields are then empty.
     */
    public record ComplexityResult(
            List<SourceUnit> units,
            int maxCc,
            double meanCc,
            HalsteadMetrics halstead,
            double maintainabilityIndex,
            String parseError) {

        public static ComplexityResult unparseable(String message) {
            return new ComplexityResult(List.of(), 0, 0.0, HalsteadMetrics.EMPTY, 0.0, message);
        }

        public boolean isParsed() {
            return parseError == null;
        }
    }

    public ComplexityResult analyze(String source) {
        // JavaParser instances are not shared between worker threads
        ParseResult<CompilationUnit> result = new JavaParser(parserConfiguration).parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            return ComplexityResult.unparseable(describe(result.getProblems()));
        }

        CompilationUnit cu = result.getResult().get();
        List<SourceUnit> units = extractUnits(cu);

        int maxCc = units.stream().mapToInt(SourceUnit::complexity).max().orElse(0);
        double meanCc = units.stream().mapToInt(SourceUnit::complexity).average().orElse(0.0);
        int totalCc = units.stream().mapToInt(SourceUnit::complexity).sum();

        HalsteadMetrics halstead = HalsteadCalculator.calculate(cu);
        double mi = maintainabilityIndex(halstead.volume(), totalCc, countNonBlankLines(source));

        return new ComplexityResult(List.copyOf(units), maxCc, meanCc, halstead, mi, null);
    }

    private List<SourceUnit> extractUnits(CompilationUnit cu) {
        List<SourceUnit> units = new ArrayList<>();

        cu.walk(Node.TreeTraversal.PREORDER, node -> {
            if (node instanceof MethodDeclaration method) {
                // Abstract and interface methods have no control flow
                if (method.getBody().isPresent()) {
                    units.add(toUnit(method, ownerName(method) + "." + method.getNameAsString()));
                }
            } else if (node instanceof ConstructorDeclaration constructor) {
                units.add(toUnit(constructor, ownerName(constructor) + ".<init>"));
            } else if (node instanceof CompactConstructorDeclaration constructor) {
                units.add(toUnit(constructor, ownerName(constructor) + ".<init>"));
            } else if (node instanceof InitializerDeclaration initializer) {
                String kind = initializer.isStatic() ? ".<clinit>" : ".<instance-init>";
                units.add(toUnit(initializer, ownerName(initializer) + kind));
            } else if (node instanceof VariableDeclarator field && isFieldUnit(field)) {
                units.add(toUnit(field, ownerName(field) + ".<field:" + field.getNameAsString() + ">"));
            }
        });

        return units;
    }

    /**
     * A field initializer is measured only when it carries behaviour: a lambda
     * body or a decision point of its own. Plain constant fields are not units.
     */
    private static boolean isFieldUnit(VariableDeclarator declarator) {
        if (!isFieldDeclarator(declarator) || declarator.getInitializer().isEmpty()) {
            return false;
        }
        boolean ownsLambda = declarator.findAll(LambdaExpr.class).stream()
                .anyMatch(lambda -> owningUnit(lambda) == declarator);
        return ownsLambda || complexityOf(declarator) > 1;
    }

    private static boolean isFieldDeclarator(Node node) {
        return node instanceof VariableDeclarator
                && node.getParentNode().filter(FieldDeclaration.class::isInstance).isPresent();
    }

    private SourceUnit toUnit(Node unit, String name) {
        int start = unit.getBegin().map(p -> p.line).orElse(0);
        int end = unit.getEnd().map(p -> p.line).orElse(start);
        return new SourceUnit(name, start, end, complexityOf(unit));
    }

    static int complexityOf(Node unit) {
        AtomicInteger complexity = new AtomicInteger(1);
        unit.walk(node -> {
            if (node != unit && owningUnit(node) == unit && isDecisionPoint(node)) {
                complexity.incrementAndGet();
            }
        });
        return complexity.get();
    }

    private static boolean isDecisionPoint(Node node) {
        if (node instanceof IfStmt || node instanceof ForStmt || node instanceof ForEachStmt
                || node instanceof WhileStmt || node instanceof DoStmt || node instanceof CatchClause
                || node instanceof ConditionalExpr) {
            return true;
        }
        if (node instanceof BinaryExpr binary) {
            return binary.getOperator() == BinaryExpr.Operator.AND
                    || binary.getOperator() == BinaryExpr.Operator.OR;
        }
        if (node instanceof SwitchEntry entry) {
            // The default arm has no labels and adds no path
            return !entry.getLabels().isEmpty();
        }
        return false;
    }

    /**
     * Nearest enclosing method, constructor, initializer block or field
     * initializer of a node.
     */
    private static Node owningUnit(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node candidate = parent.get();
            if (candidate instanceof CallableDeclaration
                    || candidate instanceof CompactConstructorDeclaration
                    || candidate instanceof InitializerDeclaration
                    || isFieldDeclarator(candidate)) {
                return candidate;
            }
            parent = candidate.getParentNode();
        }
        return null;
    }

    @SuppressWarnings("rawtypes")
    private static String ownerName(Node unit) {
        return unit.findAncestor(TypeDeclaration.class)
                .map(TypeDeclaration::getNameAsString)
                .orElse("<anonymous>");
    }

    static double maintainabilityIndex(double volume, int totalCc, int loc) {
        if (loc == 0) {
            return 100.0;
        }
        double raw = 171 - 5.2 * Math.log(Math.max(volume, 1.0)) - 0.23 * totalCc - 16.2 * Math.log(loc);
        return Math.max(0.0, Math.min(100.0, raw * 100 / 171));
    }

    private static int countNonBlankLines(String source) {
        return (int) source.lines().filter(line -> !line.isBlank()).count();
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "unknown parse error";
        }
        String message = problems.get(0).getVerboseMessage();
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline).trim() : message.trim();
    }
}
