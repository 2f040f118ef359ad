package com.repo.audit.git;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Read-only view of version-control history for a single file.
 */
public interface HistoryLog {

    /**
     * Count the distinct commits that touched a file within a recent window.
     *
     * @param file       file to look up
     * @param windowDays size of the window, counted back from now
     * @return commit count, or empty when the history cannot be determined
     *         (not a repository, untracked file, tool missing, timeout)
     * @throws InterruptedException if the run is cancelled while waiting
     */
    OptionalInt fetchRecentTouches(Path file, int windowDays) throws InterruptedException;
}
