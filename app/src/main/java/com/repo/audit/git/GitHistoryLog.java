package com.repo.audit.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * {@link HistoryLog} backed by the git command line.
 * Each call spawns at most two short-lived git processes, each bounded by the
 * configured timeout.
 */
public class GitHistoryLog implements HistoryLog {

    private static final Logger log = LoggerFactory.getLogger(GitHistoryLog.class);

    private record GitOutput(int exitCode, List<String> lines) {
    }

    private final Duration timeout;

    public GitHistoryLog(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public OptionalInt fetchRecentTouches(Path file, int windowDays) throws InterruptedException {
        Path absolute = file.toAbsolutePath().normalize();
        Path workDir = absolute.getParent();
        String fileName = absolute.getFileName().toString();

        try {
            GitOutput tracked = runGit(workDir, "ls-files", "--error-unmatch", "--", fileName);
            if (tracked.exitCode() != 0) {
                log.debug("No git history for {} (untracked or not a repository)", file);
                return OptionalInt.empty();
            }

            // --format=%H: one commit hash per line, nothing else
            GitOutput history = runGit(workDir,
                    "log", "--since=" + windowDays + " days ago", "--format=%H", "--", fileName);
            if (history.exitCode() != 0) {
                log.debug("git log failed for {} with exit code {}", file, history.exitCode());
                return OptionalInt.empty();
            }
            return OptionalInt.of(countDistinctCommits(history.lines()));

        } catch (IOException e) {
            log.warn("Git history unavailable for {}: {}", file, e.getMessage());
            return OptionalInt.empty();
        }
    }

    static int countDistinctCommits(List<String> lines) {
        Set<String> hashes = new HashSet<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                hashes.add(trimmed);
            }
        }
        return hashes.size();
    }

    private GitOutput runGit(Path workDir, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));

        // Output goes to a temp file so a chatty process can never block on a full pipe
        Path output = Files.createTempFile("audit-git-", ".out");
        Process process = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workDir.toFile());
            builder.redirectOutput(output.toFile());
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);

            process = builder.start();
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IOException("git " + args[0] + " timed out after " + timeout.toSeconds() + "s");
            }
            return new GitOutput(process.exitValue(), Files.readAllLines(output, StandardCharsets.UTF_8));
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            Files.deleteIfExists(output);
        }
    }
}
