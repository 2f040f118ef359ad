package com.repo.audit.rules;

import com.repo.audit.core.TechnicalLag;

import java.util.List;

/**
 * Fold of all file metrics in a directory run.
 */
public record ProjectTotals(
        int totalFiles,

        /** Highest unit complexity over all parsed files */
        int maxCcOverall,

        /** Mean of per-file maximum complexity over parsed files */
        double meanCc,

        /** Highest drift density over readable files */
        double maxAdfOverall,

        /** Files with any drift at all */
        List<String> pollutedFiles,

        /** Mean churn ratio over files with known history, null if none */
        Double meanCcr,

        /** Highest churn ratio over files with known history, null if none */
        Double maxCcr,

        /** HIGH as soon as one file uses a deprecated API */
        TechnicalLag globalTechnicalLag,

        List<String> lagInstances,

        /** Files that could not be read or parsed */
        List<String> unanalyzableFiles) {

    public ProjectTotals {
        pollutedFiles = List.copyOf(pollutedFiles);
        lagInstances = List.copyOf(lagInstances);
        unanalyzableFiles = List.copyOf(unanalyzableFiles);
    }
}
