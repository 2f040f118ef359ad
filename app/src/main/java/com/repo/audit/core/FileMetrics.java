package com.repo.audit.core;

import java.util.List;

/**
 * Measurements for a single audited file.
 * Created once per file per run and never mutated afterwards.
 */
public record FileMetrics(
        /** Path of the file as given to the engine */
        String path,

        /** Highest unit complexity, or null when the file could not be parsed */
        Integer maxCc,

        /** Mean unit complexity, or null when the file could not be parsed */
        Double meanCc,

        /** Number of methods, constructors and initializers found */
        int unitCount,

        /** Drift density: matching lines / non-blank lines */
        double adf,

        /** 1-based line numbers that matched an illegal pattern */
        List<Integer> driftLines,

        /** Non-blank line count (the ADF denominator) */
        int nonBlankLines,

        /** Churn ratio, or null when version-control history is unavailable */
        Double ccr,

        /** Deprecated-API flag */
        TechnicalLag technicalLag,

        /** "path:line" evidence for each deprecated-API match */
        List<String> lagInstances,

        /** Halstead difficulty (advisory) */
        double halsteadDifficulty,

        /** Halstead effort (advisory) */
        double halsteadEffort,

        /** Maintainability index 0-100 (advisory) */
        double maintainabilityIndex,

        /** "unparseable: ..." or "unreadable: ...", null for analyzable files */
        String analysisError) {

    public FileMetrics {
        driftLines = List.copyOf(driftLines);
        lagInstances = List.copyOf(lagInstances);
    }

    /**
     * Metrics for a file whose content could not be read at all.
     */
    public static FileMetrics unreadable(String path, String message, Double ccr) {
        return new FileMetrics(
                path, null, null, 0,
                0.0, List.of(), 0,
                ccr, TechnicalLag.LOW, List.of(),
                0.0, 0.0, 0.0,
                "unreadable: " + message);
    }

    public boolean isAnalyzable() {
        return analysisError == null;
    }

    /**
     * True when the text scans (ADF, lag) ran, even if parsing failed.
     */
    public boolean isReadable() {
        return analysisError == null || !analysisError.startsWith("unreadable");
    }

    public boolean isCcrKnown() {
        return ccr != null;
    }
}
