package com.repo.audit.rules;

import com.repo.audit.core.FileMetrics;
import com.repo.audit.core.PolicyConfig;
import com.repo.audit.core.TechnicalLag;

import java.util.*;

/**
 * Threshold-based verdicts at file and project level.
 * <p>
 * File rules use strict {@code >}. Project rules are a separate fold over the
 * raw metrics and are stricter: {@code >=} against {@code project_max_cc},
 * which may never exceed {@code max_cc}, plus the global technical-lag flag
 * that no single file is failed for.
 */
public class VerdictAggregator {

    public static final String MAX_CC_EXCEEDED = "max_cc exceeded";
    public static final String ADF_EXCEEDED = "adf exceeded";
    public static final String CCR_EXCEEDED = "ccr exceeded";
    public static final String CCR_UNKNOWN = "ccr unknown: churn predicate skipped (degraded confidence)";

    public static final String PROJECT_MAX_CC_REACHED = "project max_cc reached";
    public static final String PROJECT_ADF_REACHED = "project adf reached";
    public static final String GLOBAL_LAG_HIGH = "global technical lag HIGH";
    public static final String PROJECT_CCR_EXCEEDED = "project ccr exceeded";
    public static final String UNANALYZABLE_FILES = "unanalyzable files present";

    /**
     * Condition over a subject (file metrics or project totals) and the policy.
     */
    @FunctionalInterface
    public interface RuleCondition<T> {
        boolean evaluate(T subject, PolicyConfig policy);
    }

    /**
     * A failing predicate and the reason reported when it holds.
     */
    public record VerdictRule<T>(String reason, RuleCondition<T> condition) {
    }

    private final List<VerdictRule<FileMetrics>> fileRules;
    private final List<VerdictRule<ProjectTotals>> projectRules;

    public VerdictAggregator() {
        this.fileRules = buildFileRules();
        this.projectRules = buildProjectRules();
    }

    /**
     * Verdict for one file. A pure function of its inputs.
     */
    public FileVerdict evaluate(FileMetrics metrics, PolicyConfig policy) {
        List<String> reasons = new ArrayList<>();
        if (!metrics.isAnalyzable()) {
            reasons.add(metrics.analysisError());
        }
        for (VerdictRule<FileMetrics> rule : fileRules) {
            if (rule.condition().evaluate(metrics, policy)) {
                reasons.add(rule.reason());
            }
        }

        boolean failed = !reasons.isEmpty();
        boolean degraded = !metrics.isCcrKnown();
        if (degraded) {
            reasons.add(CCR_UNKNOWN);
        }
        return new FileVerdict(metrics, failed, reasons, degraded);
    }

    /**
     * Project verdict folded from the raw metrics of every file in the run.
     */
    public ProjectVerdict aggregate(List<FileMetrics> files, PolicyConfig policy) {
        ProjectTotals totals = fold(files);

        List<String> reasons = new ArrayList<>();
        for (VerdictRule<ProjectTotals> rule : projectRules) {
            if (rule.condition().evaluate(totals, policy)) {
                reasons.add(rule.reason());
            }
        }
        return new ProjectVerdict(totals, !reasons.isEmpty(), reasons);
    }

    static ProjectTotals fold(List<FileMetrics> files) {
        int maxCc = 0;
        int parsed = 0;
        double ccSum = 0.0;
        double maxAdf = 0.0;
        double ccrSum = 0.0;
        Double maxCcr = null;
        int ccrKnown = 0;

        List<String> polluted = new ArrayList<>();
        List<String> lagInstances = new ArrayList<>();
        List<String> unanalyzable = new ArrayList<>();
        TechnicalLag globalLag = TechnicalLag.LOW;

        for (FileMetrics m : files) {
            if (m.maxCc() != null) {
                maxCc = Math.max(maxCc, m.maxCc());
                ccSum += m.maxCc();
                parsed++;
            }
            if (m.isReadable()) {
                maxAdf = Math.max(maxAdf, m.adf());
                if (m.adf() > 0.0) {
                    polluted.add(m.path());
                }
            }
            if (m.isCcrKnown()) {
                ccrSum += m.ccr();
                maxCcr = maxCcr == null ? m.ccr() : Math.max(maxCcr, m.ccr());
                ccrKnown++;
            }
            if (m.technicalLag() == TechnicalLag.HIGH) {
                globalLag = TechnicalLag.HIGH;
                lagInstances.addAll(m.lagInstances());
            }
            if (!m.isAnalyzable()) {
                unanalyzable.add(m.path());
            }
        }

        return new ProjectTotals(
                files.size(),
                maxCc,
                parsed == 0 ? 0.0 : ccSum / parsed,
                maxAdf,
                polluted,
                ccrKnown == 0 ? null : ccrSum / ccrKnown,
                maxCcr,
                globalLag,
                lagInstances,
                unanalyzable);
    }

    /**
     * Get file rules for inspection.
     */
    public List<VerdictRule<FileMetrics>> getFileRules() {
        return Collections.unmodifiableList(fileRules);
    }

    /**
     * Get project rules for inspection.
     */
    public List<VerdictRule<ProjectTotals>> getProjectRules() {
        return Collections.unmodifiableList(projectRules);
    }

    private static List<VerdictRule<FileMetrics>> buildFileRules() {
        List<VerdictRule<FileMetrics>> rules = new ArrayList<>();

        rules.add(new VerdictRule<>(MAX_CC_EXCEEDED,
                (m, p) -> m.maxCc() != null && m.maxCc() > p.getMaxCc()));

        rules.add(new VerdictRule<>(ADF_EXCEEDED,
                (m, p) -> m.isReadable() && m.adf() > p.getAdfThreshold()));

        // Unknown churn is skipped, not treated as zero
        rules.add(new VerdictRule<>(CCR_EXCEEDED,
                (m, p) -> m.isCcrKnown() && m.ccr() > p.getCcrThreshold()));

        return rules;
    }

    private static List<VerdictRule<ProjectTotals>> buildProjectRules() {
        List<VerdictRule<ProjectTotals>> rules = new ArrayList<>();

        rules.add(new VerdictRule<>(PROJECT_MAX_CC_REACHED,
                (t, p) -> t.maxCcOverall() >= p.getProjectMaxCc()));

        rules.add(new VerdictRule<>(PROJECT_ADF_REACHED,
                (t, p) -> t.maxAdfOverall() >= p.getAdfThreshold()));

        rules.add(new VerdictRule<>(GLOBAL_LAG_HIGH,
                (t, p) -> t.globalTechnicalLag() == TechnicalLag.HIGH));

        rules.add(new VerdictRule<>(PROJECT_CCR_EXCEEDED,
                (t, p) -> t.maxCcr() != null && t.maxCcr() > p.getCcrThreshold()));

        rules.add(new VerdictRule<>(UNANALYZABLE_FILES,
                (t, p) -> !t.unanalyzableFiles().isEmpty()));

        return rules;
    }
}
