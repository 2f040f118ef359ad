package com.repo.audit.report;

import com.repo.audit.core.FileMetrics;
import com.repo.audit.core.PolicyConfig;
import com.repo.audit.rules.FileVerdict;
import com.repo.audit.rules.ProjectTotals;
import com.repo.audit.rules.ProjectVerdict;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text report: a per-file table plus the project summary, or a metrics
 * block in single-file mode. Output is deterministic for a given report.
 */
public class TerminalReporter {

    private static final int WIDTH = 86;

    private final PrintStream out;

    public TerminalReporter(PrintStream out) {
        this.out = out;
    }

    public void print(AuditReport report, PolicyConfig policy) {
        if (report.isDirectoryRun()) {
            printProject(report, policy);
        } else {
            report.files().forEach(verdict -> printSingleFile(report, verdict, policy));
        }
    }

    private void printSingleFile(AuditReport report, FileVerdict verdict, PolicyConfig policy) {
        FileMetrics m = verdict.metrics();

        out.println("=".repeat(WIDTH));
        out.println("        ARCHITECTURAL AUDIT v" + AuditReport.VERSION);
        out.println("=".repeat(WIDTH));
        out.println("Target : " + m.path());
        out.println("Policy : " + report.configSource());
        out.println("-".repeat(WIDTH));
        out.println("[Core Metrics]");
        out.println(fmt("  Max Cyclomatic Complexity : %s (Limit: %d)", cc(m.maxCc()), policy.getMaxCc()));
        out.println(fmt("  Mean Cyclomatic Complexity: %s", m.meanCc() == null ? "n/a" : fmt("%.2f", m.meanCc())));
        out.println(fmt("  Units                     : %d", m.unitCount()));
        out.println(fmt("  Maintainability Index     : %.2f", m.maintainabilityIndex()));
        out.println(fmt("  Halstead Effort           : %.2f", m.halsteadEffort()));
        out.println("-".repeat(WIDTH));
        out.println("[Architecture Signals]");
        out.println(fmt("  Churn Ratio (CCR)         : %s (Limit: %.2f)", ratio(m.ccr()), policy.getCcrThreshold()));
        out.println(fmt("  Drift Density (ADF)       : %.4f (Limit: %.4f)", m.adf(), policy.getAdfThreshold()));
        printLines("    -> line ", m.driftLines().stream().map(String::valueOf).toList());
        out.println("  Technical Lag (TL)        : " + m.technicalLag());
        printLines("    -> ", m.lagInstances());
        out.println("-".repeat(WIDTH));
        printReasons(verdict.reasons());
        out.println("Verdict: [" + passFail(verdict.failed()) + "]");
        out.println("=".repeat(WIDTH));
    }

    private void printProject(AuditReport report, PolicyConfig policy) {
        ProjectVerdict project = report.project();
        ProjectTotals t = project.totals();

        out.println("=".repeat(WIDTH));
        out.println("        ARCHITECTURAL PROJECT AUDIT v" + AuditReport.VERSION);
        out.println("=".repeat(WIDTH));
        out.println("  Target       : " + report.target());
        out.println("  Policy       : " + report.configSource());
        out.println("  Files scanned: " + t.totalFiles());
        out.println("-".repeat(WIDTH));

        out.println(fmt("| %-40s | %-4s | %-7s | %-7s | %-4s | %-7s |",
                "File", "CC", "ADF", "CCR", "TL", "Verdict"));
        out.println("|" + "-".repeat(42) + "|" + "-".repeat(6) + "|" + "-".repeat(9) + "|" + "-".repeat(9)
                + "|" + "-".repeat(6) + "|" + "-".repeat(9) + "|");
        for (FileVerdict verdict : report.files()) {
            FileMetrics m = verdict.metrics();
            out.println(fmt("| %-40s | %4s | %7.4f | %7s | %-4s | %-7s |",
                    truncate(m.path(), 40),
                    cc(m.maxCc()),
                    m.adf(),
                    ratio(m.ccr()),
                    m.technicalLag(),
                    passFail(verdict.failed()) + (verdict.degraded() ? "*" : "")));
        }
        out.println("-".repeat(WIDTH));
        if (report.files().stream().anyMatch(FileVerdict::degraded)) {
            out.println("  * churn history unavailable, verdict based on CC and ADF only");
        }

        List<FileVerdict> failedFiles = report.files().stream().filter(FileVerdict::failed).toList();
        if (!failedFiles.isEmpty()) {
            out.println("[Failed Files]");
            for (FileVerdict verdict : failedFiles) {
                List<String> causes = verdict.reasons().stream()
                        .filter(reason -> !reason.startsWith("ccr unknown"))
                        .toList();
                out.println("  " + verdict.path() + ": " + String.join("; ", causes));
            }
            out.println("-".repeat(WIDTH));
        }

        out.println("[Project Summary]");
        out.println(fmt("  Max CC (across all files) : %d (Limit: < %d)", t.maxCcOverall(), policy.getProjectMaxCc()));
        out.println(fmt("  Mean CC                   : %.1f", t.meanCc()));
        out.println(fmt("  Max ADF                   : %.4f (Limit: < %.4f)", t.maxAdfOverall(), policy.getAdfThreshold()));
        if (!t.pollutedFiles().isEmpty()) {
            out.println(fmt("  Polluted files (%d):", t.pollutedFiles().size()));
            printLines("    -> ", t.pollutedFiles());
        }
        out.println("  Mean CCR                  : " + ratio(t.meanCcr()));
        out.println(fmt("  Max CCR                   : %s (Limit: <= %.2f)", ratio(t.maxCcr()), policy.getCcrThreshold()));
        out.println("  Global TL                 : " + t.globalTechnicalLag());
        printLines("    -> ", t.lagInstances());
        if (!t.unanalyzableFiles().isEmpty()) {
            out.println(fmt("  Unanalyzable files (%d):", t.unanalyzableFiles().size()));
            printLines("    -> ", t.unanalyzableFiles());
        }
        out.println("-".repeat(WIDTH));
        printReasons(project.reasons());
        out.println("  Project Verdict: [" + passFail(project.failed()) + "]");
        out.println("=".repeat(WIDTH));
    }

    private void printReasons(List<String> reasons) {
        for (String reason : reasons) {
            out.println("  ! " + reason);
        }
    }

    private void printLines(String prefix, List<String> lines) {
        for (String line : lines) {
            out.println(prefix + line);
        }
    }

    private static String passFail(boolean failed) {
        return failed ? "FAIL" : "PASS";
    }

    private static String cc(Integer value) {
        return value == null ? "n/a" : String.valueOf(value);
    }

    private static String ratio(Double value) {
        return value == null ? "n/a" : fmt("%.4f", value);
    }

    // Locale.ROOT keeps the decimal separator stable across CI machines
    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }

    static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
