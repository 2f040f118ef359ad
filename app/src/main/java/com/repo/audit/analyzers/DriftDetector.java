package com.repo.audit.analyzers;

import com.repo.audit.core.PolicyConfig;

import java.util.List;

/**
 * Layer-violation density: the share of non-blank lines that call into
 * presentation or console I/O where only business logic is expected.
 * <p>
 * Density rather than a count, so one stray diagnostic line weighs less in a
 * large file than in a ten-line one.
 */
public class DriftDetector {

    public record DriftResult(
            /** Matching lines / non-blank lines, 0 for an empty file */
            double adf,

            /** 1-based numbers of the matching lines */
            List<Integer> driftLines,

            int nonBlankLines) {
    }

    public DriftResult detect(List<String> lines, PolicyConfig policy) {
        int nonBlank = LineScanner.countNonBlank(lines);
        if (nonBlank == 0) {
            return new DriftResult(0.0, List.of(), 0);
        }

        List<Integer> driftLines = LineScanner.matchingLines(lines, policy.getIllegalPatterns());
        double adf = (double) driftLines.size() / nonBlank;
        return new DriftResult(adf, List.copyOf(driftLines), nonBlank);
    }
}
