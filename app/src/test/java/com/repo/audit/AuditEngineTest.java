package com.repo.audit;

import com.repo.audit.core.AuditException;
import com.repo.audit.core.FileMetrics;
import com.repo.audit.core.PolicyConfig;
import com.repo.audit.core.TechnicalLag;
import com.repo.audit.git.HistoryLog;
import com.repo.audit.report.AuditReport;
import com.repo.audit.rules.FileVerdict;
import com.repo.audit.rules.VerdictAggregator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class AuditEngineTest {

    @TempDir
    Path tempDir;

    private static final HistoryLog NO_HISTORY = (file, days) -> OptionalInt.empty();
    private static final HistoryLog QUIET_HISTORY = (file, days) -> OptionalInt.of(1);

    private final PolicyConfig policy = PolicyConfig.defaults();

    static String cleanClass(String name, int methods) {
        StringBuilder source = new StringBuilder("package demo;\n\npublic class " + name + " {\n\n");
        for (int i = 0; i < methods; i++) {
            source.append("    public int value").append(i).append("(int x) {\n")
                    .append("        int y = x * ").append(i).append(";\n")
                    .append("        return y + 1;\n")
                    .append("    }\n\n");
        }
        return source.append("}\n").toString();
    }

    @Test
    void testCleanFilePasses() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Clean.java"), cleanClass("Clean", 10));

        AuditReport report = new AuditEngine(QUIET_HISTORY).run(file, policy);

        assertFalse(report.isDirectoryRun());
        assertEquals(0, report.exitCode());
        FileMetrics m = report.files().get(0).metrics();
        assertEquals(1, m.maxCc());
        assertEquals(10, m.unitCount());
        assertEquals(0.0, m.adf());
        assertEquals(0.1, m.ccr(), 1e-9);
        assertEquals(TechnicalLag.LOW, m.technicalLag());
        assertTrue(m.isAnalyzable());
    }

    @Test
    void testDriftingFileFails() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Noisy.java"), """
                package demo;

                public class Noisy {
                    public int total(int a, int b) {
                        System.out.println("adding");
                        return a + b;
                    }
                }
                """);

        AuditReport report = new AuditEngine(QUIET_HISTORY).run(file, policy);

        FileVerdict verdict = report.files().get(0);
        assertTrue(verdict.failed());
        assertEquals(List.of(5), verdict.metrics().driftLines());
        assertEquals(1.0 / 7, verdict.metrics().adf(), 1e-9);
        assertEquals(List.of(VerdictAggregator.ADF_EXCEEDED), verdict.reasons());
        assertEquals(1, report.exitCode());
    }

    @Test
    void testUnknownHistoryIsDegradedNotFailed() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Clean.java"), cleanClass("Clean", 2));

        AuditReport report = new AuditEngine(NO_HISTORY).run(file, policy);

        FileVerdict verdict = report.files().get(0);
        assertNull(verdict.metrics().ccr());
        assertTrue(verdict.degraded());
        assertFalse(verdict.failed());
    }

    @Test
    void testUnparseableFileIsReportedNotThrown() throws Exception {
        Path file = Files.writeString(tempDir.resolve("Broken.java"), "public class Broken { void m( {\n");

        AuditReport report = new AuditEngine(QUIET_HISTORY).run(file, policy);

        FileVerdict verdict = report.files().get(0);
        assertTrue(verdict.failed());
        assertNull(verdict.metrics().maxCc());
        assertTrue(verdict.reasons().get(0).startsWith("unparseable: "));
    }

    @Test
    void testDirectoryRun() throws Exception {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("B.java"), cleanClass("B", 3));
        Files.writeString(src.resolve("A.java"), """
                import java.io.File;

                public class A {
                    public File open(String name) {
                        return new File(name);
                    }
                }
                """);
        Path generated = Files.createDirectories(src.resolve("target"));
        Files.writeString(generated.resolve("Skipped.java"), "not java at all");

        AuditReport report = new AuditEngine(QUIET_HISTORY).run(src, policy);

        assertTrue(report.isDirectoryRun());
        assertEquals(List.of(src.resolve("A.java").toString(), src.resolve("B.java").toString()),
                report.files().stream().map(FileVerdict::path).toList());
        assertTrue(report.files().stream().noneMatch(FileVerdict::failed), "Lag alone never fails a file");
        assertEquals(TechnicalLag.HIGH, report.project().totals().globalTechnicalLag());
        assertEquals(List.of(VerdictAggregator.GLOBAL_LAG_HIGH), report.project().reasons());
        assertEquals(1, report.exitCode());
    }

    @Test
    void testDirectoryRunIsDeterministic() throws Exception {
        for (int i = 0; i < 12; i++) {
            Files.writeString(tempDir.resolve("C" + i + ".java"), cleanClass("C" + i, i + 1));
        }
        AuditEngine engine = new AuditEngine(QUIET_HISTORY);

        List<FileMetrics> first = engine.run(tempDir, policy).files().stream().map(FileVerdict::metrics).toList();
        List<FileMetrics> second = engine.run(tempDir, policy).files().stream().map(FileVerdict::metrics).toList();

        assertEquals(first, second);
    }

    @Test
    void testMissingTarget() {
        assertThrows(AuditException.class,
                () -> new AuditEngine(NO_HISTORY).run(tempDir.resolve("missing"), policy));
    }

    @Test
    void testDirectoryWithoutSources() throws IOException {
        Files.writeString(tempDir.resolve("README.md"), "# nothing here\n");
        AuditException e = assertThrows(AuditException.class,
                () -> new AuditEngine(NO_HISTORY).run(tempDir, policy));
        assertTrue(e.getMessage().startsWith("No Java source files"));
    }

    @Test
    void testHistoryCancellationPropagates() throws IOException {
        Path file = Files.writeString(tempDir.resolve("Clean.java"), cleanClass("Clean", 1));
        HistoryLog interrupted = (f, days) -> {
            throw new InterruptedException("stop");
        };

        assertThrows(InterruptedException.class, () -> new AuditEngine(interrupted).run(tempDir, policy));
        assertThrows(InterruptedException.class, () -> new AuditEngine(interrupted).run(file, policy));
    }
}
