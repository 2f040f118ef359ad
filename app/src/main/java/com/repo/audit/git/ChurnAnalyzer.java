package com.repo.audit.git;

import com.repo.audit.core.PolicyConfig;

import java.nio.file.Path;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Churn ratio (CCR) from recent version-control activity.
 * <p>
 * ccr = min(commits in the last {@code churn_window_days} days / {@code churn_baseline_commits}, 1.0).
 * With the defaults (14 days, 10 commits) a file touched three times in two
 * weeks scores 0.3. Unavailable history yields an empty result, never 0.
 */
public class ChurnAnalyzer {

    private final HistoryLog historyLog;

    public ChurnAnalyzer(HistoryLog historyLog) {
        this.historyLog = historyLog;
    }

    public OptionalDouble measure(Path file, PolicyConfig policy) throws InterruptedException {
        OptionalInt touches = historyLog.fetchRecentTouches(file, policy.getChurnWindowDays());
        if (touches.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(normalize(touches.getAsInt(), policy.getChurnBaselineCommits()));
    }

    static double normalize(int touches, int baselineCommits) {
        return Math.min((double) touches / baselineCommits, 1.0);
    }
}
