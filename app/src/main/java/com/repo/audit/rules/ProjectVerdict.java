package com.repo.audit.rules;

import java.util.List;

/**
 * PASS/FAIL outcome for a whole directory run.
 */
public record ProjectVerdict(ProjectTotals totals, boolean failed, List<String> reasons) {

    public ProjectVerdict {
        reasons = List.copyOf(reasons);
    }
}
