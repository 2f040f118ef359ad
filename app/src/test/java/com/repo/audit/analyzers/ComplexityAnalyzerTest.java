package com.repo.audit.analyzers;

import com.repo.audit.analyzers.ComplexityAnalyzer.ComplexityResult;
import com.repo.audit.core.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityAnalyzerTest {

    private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

    @Test
    void testStraightLineMethod() {
        ComplexityResult result = analyzer.analyze("""
                class Simple {
                    int identity(int x) {
                        return x;
                    }
                }
                """);

        assertTrue(result.isParsed());
        assertEquals(1, result.units().size());
        SourceUnit unit = result.units().get(0);
        assertEquals("Simple.identity", unit.name());
        assertEquals(2, unit.startLine());
        assertEquals(4, unit.endLine());
        assertEquals(1, unit.complexity());
        assertEquals(1, result.maxCc());
    }

    @Test
    void testTwentyFiveIfs() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            body.append("        if (x == ").append(i).append(") { x++; }\n");
        }
        String source = "class Branchy {\n    void run(int x) {\n" + body + "    }\n}\n";

        ComplexityResult result = analyzer.analyze(source);

        assertEquals(26, result.maxCc());
    }

    @Test
    void testBooleanOperatorsAndTernary() {
        ComplexityResult result = analyzer.analyze("""
                class Logic {
                    boolean check(int a, int b) {
                        if (a > 0 && b > 0 || a < b) {
                            return true;
                        }
                        return a > b ? true : false;
                    }
                }
                """);

        // 1 + if + && + || + ?:
        assertEquals(5, result.maxCc());
    }

    @Test
    void testSwitchCountsNonDefaultArms() {
        ComplexityResult result = analyzer.analyze("""
                class Switches {
                    int classic(int x) {
                        switch (x) {
                            case 1: return 10;
                            case 2: return 20;
                            default: return 0;
                        }
                    }

                    String arrows(int x) {
                        return switch (x) {
                            case 1, 2 -> "low";
                            case 3 -> "mid";
                            default -> "high";
                        };
                    }
                }
                """);

        assertEquals(List.of(3, 3), result.units().stream().map(SourceUnit::complexity).toList());
    }

    @Test
    void testLoopsAndCatchClauses() {
        ComplexityResult result = analyzer.analyze("""
                import java.util.List;

                class Loops {
                    void run(List<String> items) {
                        for (int i = 0; i < 3; i++) { }
                        for (String item : items) { }
                        int n = 0;
                        while (n < 3) { n++; }
                        do { n--; } while (n > 0);
                        try {
                            Integer.parseInt("1");
                        } catch (NumberFormatException e) {
                            n = -1;
                        } catch (RuntimeException e) {
                            n = -2;
                        } finally {
                            n = 0;
                        }
                    }
                }
                """);

        // 1 + 4 loops + 2 catches; finally adds nothing
        assertEquals(7, result.maxCc());
    }

    @Test
    void testLambdaCountsTowardEnclosingMethod() {
        ComplexityResult result = analyzer.analyze("""
                import java.util.List;

                class Lambdas {
                    void visit(List<Integer> values) {
                        values.forEach(v -> {
                            if (v > 0) {
                                System.nanoTime();
                            }
                        });
                    }
                }
                """);

        assertEquals(1, result.units().size());
        assertEquals(2, result.maxCc());
    }

    @Test
    void testAnonymousClassMethodsAreSeparateUnits() {
        ComplexityResult result = analyzer.analyze("""
                class Outer {
                    void start(boolean a, boolean b) {
                        Runnable task = new Runnable() {
                            @Override
                            public void run() {
                                if (a) { }
                                if (b) { }
                            }
                        };
                        if (a) {
                            task.run();
                        }
                    }
                }
                """);

        assertEquals(2, result.units().size());
        assertEquals("Outer.start", result.units().get(0).name());
        assertEquals(2, result.units().get(0).complexity(), "Inner branches do not leak into the outer method");
        assertEquals(3, result.units().get(1).complexity());
        assertEquals(3, result.maxCc());
        assertEquals(2.5, result.meanCc(), 1e-9);
    }

    @Test
    void testConstructorsInitializersAndAbstractMethods() {
        ComplexityResult result = analyzer.analyze("""
                abstract class Shape {
                    static int count;
                    static {
                        if (count < 0) { count = 0; }
                    }

                    Shape() {
                        count++;
                    }

                    abstract double area();
                }
                """);

        assertEquals(List.of("Shape.<clinit>", "Shape.<init>"),
                result.units().stream().map(SourceUnit::name).toList());
        assertEquals(2, result.maxCc());
    }

    @Test
    void testRecordCompactConstructorIsAUnit() {
        StringBuilder checks = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            checks.append("        if (x == ").append(i).append(") { x++; }\n");
        }
        String source = "record Range(int x) {\n    Range {\n" + checks + "    }\n}\n";

        ComplexityResult result = analyzer.analyze(source);

        assertTrue(result.isParsed());
        assertEquals(List.of("Range.<init>"), result.units().stream().map(SourceUnit::name).toList());
        assertEquals(26, result.maxCc());
    }

    @Test
    void testFieldLambdaIsAUnit() {
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < 25; i++) {
            body.append("        if (x == ").append(i).append(") { return ").append(i).append("; }\n");
        }
        String source = "import java.util.function.IntUnaryOperator;\n\n"
                + "class Ops {\n"
                + "    static final IntUnaryOperator OP = x -> {\n" + body + "        return x;\n    };\n"
                + "    static final int LIMIT = 10;\n"
                + "    final boolean strict = LIMIT > 5 ? true : false;\n"
                + "}\n";

        ComplexityResult result = analyzer.analyze(source);

        assertEquals(List.of("Ops.<field:OP>", "Ops.<field:strict>"),
                result.units().stream().map(SourceUnit::name).toList(), "Plain constants are not units");
        assertEquals(26, result.units().get(0).complexity());
        assertEquals(2, result.units().get(1).complexity());
        assertEquals(26, result.maxCc());
    }

    @Test
    void testFieldOfAnonymousClassInsideMethodStaysSeparate() {
        ComplexityResult result = analyzer.analyze("""
                import java.util.function.IntPredicate;

                class Holder {
                    Object make(boolean flag) {
                        if (flag) {
                            return null;
                        }
                        return new Object() {
                            final IntPredicate positive = v -> v > 0 && v < 100;
                        };
                    }
                }
                """);

        assertEquals(List.of("Holder.make", "Holder.<field:positive>"),
                result.units().stream().map(SourceUnit::name).toList());
        assertEquals(2, result.units().get(0).complexity());
        assertEquals(2, result.units().get(1).complexity());
    }

    @Test
    void testFileWithoutUnits() {
        ComplexityResult result = analyzer.analyze("interface Marker { }\n");

        assertTrue(result.isParsed());
        assertTrue(result.units().isEmpty());
        assertEquals(0, result.maxCc());
        assertEquals(0.0, result.meanCc());
    }

    @Test
    void testUnparseableSource() {
        ComplexityResult result = analyzer.analyze("class Broken { void m( { }\n");

        assertFalse(result.isParsed());
        assertNotNull(result.parseError());
        assertFalse(result.parseError().isBlank());
        assertTrue(result.units().isEmpty());
    }

    @Test
    void testAdvisoryMetricsArePopulated() {
        ComplexityResult result = analyzer.analyze("""
                class Calc {
                    int add(int a, int b) {
                        return a + b;
                    }
                }
                """);

        assertTrue(result.halstead().volume() > 0);
        assertTrue(result.halstead().difficulty() > 0);
        assertTrue(result.maintainabilityIndex() > 0 && result.maintainabilityIndex() <= 100);
    }

    @Test
    void testMaintainabilityIndexBounds() {
        assertEquals(100.0, ComplexityAnalyzer.maintainabilityIndex(0.0, 0, 0));
        assertEquals(0.0, ComplexityAnalyzer.maintainabilityIndex(1e12, 5000, 100_000));
        double small = ComplexityAnalyzer.maintainabilityIndex(50.0, 2, 10);
        double large = ComplexityAnalyzer.maintainabilityIndex(5000.0, 80, 600);
        assertTrue(small > large);
    }
}
