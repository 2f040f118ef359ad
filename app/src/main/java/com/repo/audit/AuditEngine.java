package com.repo.audit;

import com.repo.audit.analyzers.ComplexityAnalyzer;
import com.repo.audit.analyzers.ComplexityAnalyzer.ComplexityResult;
import com.repo.audit.analyzers.DriftDetector;
import com.repo.audit.analyzers.DriftDetector.DriftResult;
import com.repo.audit.analyzers.LagDetector;
import com.repo.audit.analyzers.LagDetector.LagResult;
import com.repo.audit.core.AuditException;
import com.repo.audit.core.FileMetrics;
import com.repo.audit.core.PolicyConfig;
import com.repo.audit.core.SourceCollector;
import com.repo.audit.git.ChurnAnalyzer;
import com.repo.audit.git.HistoryLog;
import com.repo.audit.report.AuditReport;
import com.repo.audit.rules.FileVerdict;
import com.repo.audit.rules.ProjectVerdict;
import com.repo.audit.rules.VerdictAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one audit: collect files, measure each one, verdict, aggregate.
 * <p>
 * Files are measured in parallel. Analyzers keep no cross-file state, so the
 * only shared structure is the append-only verdict list.
 */
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    private final ComplexityAnalyzer complexityAnalyzer = new ComplexityAnalyzer();
    private final DriftDetector driftDetector = new DriftDetector();
    private final LagDetector lagDetector = new LagDetector();
    private final VerdictAggregator aggregator = new VerdictAggregator();
    private final SourceCollector collector = new SourceCollector();
    private final ChurnAnalyzer churnAnalyzer;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile ExecutorService executor;
    private final List<Future<?>> inFlight = new CopyOnWriteArrayList<>();

    public AuditEngine(HistoryLog historyLog) {
        this.churnAnalyzer = new ChurnAnalyzer(historyLog);
    }

    /**
     * Audit a single file or a whole directory.
     *
     * @throws AuditException       if the target is missing or cannot be walked
     * @throws InterruptedException if the run was cancelled; no report exists then
     */
    public AuditReport run(Path target, PolicyConfig policy) throws AuditException, InterruptedException {
        if (!Files.exists(target)) {
            throw new AuditException("Target does not exist: " + target);
        }

        if (Files.isRegularFile(target)) {
            FileVerdict verdict = aggregator.evaluate(measure(target, policy), policy);
            checkCancelled();
            return new AuditReport(target.toString(), policy.getSource(), Instant.now(),
                    List.of(verdict), null, verdict.failed() ? 1 : 0);
        }

        if (!Files.isDirectory(target)) {
            throw new AuditException("Target is neither a file nor a directory: " + target);
        }

        List<Path> files;
        try {
            files = collector.collect(target, policy);
        } catch (IOException e) {
            throw new AuditException("Could not walk " + target + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) {
            throw new AuditException("No Java source files found in " + target);
        }
        log.info("Auditing {} files under {} with {} workers", files.size(), target,
                Math.min(policy.getParallelism(), files.size()));

        List<FileVerdict> verdicts = measureAll(files, policy);
        verdicts.sort(Comparator.comparing(FileVerdict::path));

        List<FileMetrics> metrics = verdicts.stream().map(FileVerdict::metrics).toList();
        ProjectVerdict project = aggregator.aggregate(metrics, policy);

        return new AuditReport(target.toString(), policy.getSource(), Instant.now(),
                verdicts, project, project.failed() ? 1 : 0);
    }

    /**
     * Abandon a running audit. In-flight git processes are destroyed by their
     * interrupted workers; {@link #run} then throws InterruptedException.
     */
    public void cancel() {
        cancelled.set(true);
        inFlight.forEach(future -> future.cancel(true));
        ExecutorService pool = executor;
        if (pool != null) {
            pool.shutdownNow();
            try {
                pool.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private List<FileVerdict> measureAll(List<Path> files, PolicyConfig policy)
            throws AuditException, InterruptedException {
        List<FileVerdict> verdicts = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(policy.getParallelism(), files.size()));
        executor = pool;

        try {
            for (Path file : files) {
                inFlight.add(pool.submit(() -> {
                    verdicts.add(aggregator.evaluate(measure(file, policy), policy));
                    return null;
                }));
                checkCancelled();
            }
            for (Future<?> future : inFlight) {
                await(future);
            }
        } catch (RejectedExecutionException e) {
            throw new InterruptedException("Audit cancelled");
        } finally {
            pool.shutdownNow();
            executor = null;
            inFlight.clear();
        }

        checkCancelled();
        return new ArrayList<>(verdicts);
    }

    private void await(Future<?> future) throws AuditException, InterruptedException {
        try {
            future.get();
        } catch (CancellationException e) {
            throw new InterruptedException("Audit cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException interrupted) {
                throw interrupted;
            }
            throw new AuditException("File analysis failed: " + cause.getMessage(), cause);
        }
    }

    FileMetrics measure(Path file, PolicyConfig policy) throws InterruptedException {
        String path = file.toString();

        // History first: it is independent of the file content
        OptionalDouble churn = churnAnalyzer.measure(file, policy);
        Double ccr = churn.isPresent() ? churn.getAsDouble() : null;

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", path, e.toString());
            return FileMetrics.unreadable(path, e.toString(), ccr);
        }

        List<String> lines = content.lines().toList();
        ComplexityResult complexity = analyzeComplexity(path, content);
        DriftResult drift = driftDetector.detect(lines, policy);
        LagResult lag = lagDetector.detect(path, lines, policy);

        boolean parsed = complexity.isParsed();
        return new FileMetrics(
                path,
                parsed ? complexity.maxCc() : null,
                parsed ? complexity.meanCc() : null,
                complexity.units().size(),
                drift.adf(),
                drift.driftLines(),
                drift.nonBlankLines(),
                ccr,
                lag.level(),
                lag.instances(),
                complexity.halstead().difficulty(),
                complexity.halstead().effort(),
                complexity.maintainabilityIndex(),
                parsed ? null : "unparseable: " + complexity.parseError());
    }

    private ComplexityResult analyzeComplexity(String path, String content) {
        ComplexityResult result;
        try {
            result = complexityAnalyzer.analyze(content);
        } catch (RuntimeException | StackOverflowError e) {
            // Parser internals failing on pathological input is still a per-file problem
            log.warn("Parser crashed on {}: {}", path, e.toString());
            return ComplexityResult.unparseable(e.toString());
        }
        if (!result.isParsed()) {
            log.warn("Could not parse {}: {}", path, result.parseError());
        }
        return result;
    }

    private void checkCancelled() throws InterruptedException {
        if (cancelled.get()) {
            throw new InterruptedException("Audit cancelled");
        }
    }
}
