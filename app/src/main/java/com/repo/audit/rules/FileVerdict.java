package com.repo.audit.rules;

import com.repo.audit.core.FileMetrics;

import java.util.List;

/**
 * PASS/FAIL outcome for one file.
 */
public record FileVerdict(
        FileMetrics metrics,

        boolean failed,

        /** Failure causes and caveats, in evaluation order */
        List<String> reasons,

        /** True when the churn predicate could not be evaluated */
        boolean degraded) {

    public FileVerdict {
        reasons = List.copyOf(reasons);
    }

    public String path() {
        return metrics.path();
    }
}
