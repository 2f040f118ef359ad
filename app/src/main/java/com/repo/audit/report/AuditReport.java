package com.repo.audit.report;

import com.repo.audit.rules.FileVerdict;
import com.repo.audit.rules.ProjectVerdict;

import java.time.Instant;
import java.util.List;

/**
 * Complete outcome of one audit run.
 * Never persisted by the engine; callers decide whether to serialize it.
 */
public record AuditReport(
        /** Audited path as given on the command line */
        String target,

        /** Policy file path, or "<defaults>" */
        String configSource,

        Instant generatedAt,

        /** File verdicts sorted by path */
        List<FileVerdict> files,

        /** Project verdict for directory runs, null for single-file runs */
        ProjectVerdict project,

        /** 0 = PASS, 1 = FAIL */
        int exitCode) {

    public static final String VERSION = "1.0";

    public AuditReport {
        files = List.copyOf(files);
    }

    public boolean isDirectoryRun() {
        return project != null;
    }

    public boolean isFailed() {
        return exitCode != 0;
    }
}
