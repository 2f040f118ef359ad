package com.repo.audit;

import com.repo.audit.core.AuditException;
import com.repo.audit.core.PolicyConfig;
import com.repo.audit.core.PolicyException;
import com.repo.audit.git.GitHistoryLog;
import com.repo.audit.git.HistoryLog;
import com.repo.audit.report.AuditReport;
import com.repo.audit.report.JsonReporter;
import com.repo.audit.report.TerminalReporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Command-line entry point.
 * <p>
 * Usage: audit &lt;path&gt; [--output &lt;json-path&gt;] [--config &lt;path&gt;]
 * <p>
 * Exit codes: 0 PASS, 1 FAIL, 2 the audit could not run, 130 cancelled.
 */
public class App {

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;
    static final int EXIT_ERROR = 2;
    static final int EXIT_CANCELLED = 130;

    private record CliArgs(Path target, Path outputPath, Path configPath, boolean help) {
    }

    private final PrintStream out;
    private final PrintStream err;
    private final Function<PolicyConfig, HistoryLog> historyLogFactory;

    private volatile AuditEngine activeEngine;

    public App(PrintStream out, PrintStream err, Function<PolicyConfig, HistoryLog> historyLogFactory) {
        this.out = out;
        this.err = err;
        this.historyLogFactory = historyLogFactory;
    }

    public static void main(String[] args) {
        App app = new App(System.out, System.err,
                policy -> new GitHistoryLog(Duration.ofSeconds(policy.getGitTimeoutSeconds())));

        // Ctrl-C: abandon in-flight git calls and emit no partial report
        Thread cancelHook = new Thread(app::cancel, "audit-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);

        int exitCode = app.run(args);

        System.exit(detachCancelHook(() -> Runtime.getRuntime().removeShutdownHook(cancelHook), exitCode));
    }

    /**
     * Remove the cancel hook before a normal exit. Once the JVM is already
     * shutting down the hook has fired, so the run counts as cancelled.
     */
    static int detachCancelHook(Runnable removeHook, int exitCode) {
        try {
            removeHook.run();
            return exitCode;
        } catch (IllegalStateException e) {
            return EXIT_CANCELLED;
        }
    }

    public int run(String[] args) {
        CliArgs cliArgs = parseArgs(args);
        if (cliArgs == null) {
            printUsage(err);
            return EXIT_ERROR;
        }
        if (cliArgs.help()) {
            printUsage(out);
            return EXIT_PASS;
        }

        try {
            Path target = cliArgs.target();
            if (!Files.exists(target)) {
                throw new AuditException("Target does not exist: " + target);
            }

            PolicyConfig policy = cliArgs.configPath() != null
                    ? PolicyConfig.loadFile(cliArgs.configPath())
                    : PolicyConfig.load(target);

            if (cliArgs.outputPath() != null) {
                ensureOutsideScannedTree(cliArgs.outputPath(), target);
            }

            AuditEngine engine = new AuditEngine(historyLogFactory.apply(policy));
            activeEngine = engine;
            AuditReport report;
            try {
                report = engine.run(target, policy);
            } finally {
                activeEngine = null;
            }

            new TerminalReporter(out).print(report, policy);

            if (cliArgs.outputPath() != null) {
                new JsonReporter().write(report, cliArgs.outputPath());
                out.println("\nJSON written to " + cliArgs.outputPath());
            }
            return report.isFailed() ? EXIT_FAIL : EXIT_PASS;

        } catch (PolicyException e) {
            err.println("Policy error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (AuditException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("Error: could not write JSON report: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Audit cancelled, no report emitted.");
            return EXIT_CANCELLED;
        }
    }

    void cancel() {
        AuditEngine engine = activeEngine;
        if (engine != null) {
            err.println("Cancelling audit...");
            engine.cancel();
        }
    }

    static void ensureOutsideScannedTree(Path outputPath, Path target) throws AuditException {
        Path output = outputPath.toAbsolutePath().normalize();
        Path scanned = target.toAbsolutePath().normalize();

        boolean inside = Files.isDirectory(scanned) ? output.startsWith(scanned) : output.equals(scanned);
        if (inside) {
            throw new AuditException("Refusing to write the JSON report into the scanned tree: " + outputPath);
        }
    }

    private static CliArgs parseArgs(String[] args) {
        Path target = null;
        Path outputPath = null;
        Path configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliArgs(null, null, null, true);
                }
                case "--output", "-o" -> {
                    if (i + 1 >= args.length)
                        return null;
                    outputPath = Path.of(args[++i]);
                }
                case "--config", "-c" -> {
                    if (i + 1 >= args.length)
                        return null;
                    configPath = Path.of(args[++i]);
                }
                default -> {
                    if (args[i].startsWith("-") || target != null)
                        return null;
                    target = Path.of(args[i]);
                }
            }
        }

        if (target == null) {
            return null;
        }
        return new CliArgs(target, outputPath, configPath, false);
    }

    private static void printUsage(PrintStream stream) {
        stream.println("""
                Usage: audit <path> [--output <json-path>] [--config <path>]

                Arguments:
                  <path>                  Java source file or directory to audit
                  --output, -o <path>     Also write the full report as JSON (never inside <path>)
                  --config, -c <path>     Policy file to use instead of searching for .policy.yaml

                Exit codes:
                  0  all audited units PASS
                  1  at least one FAIL
                  2  the audit could not run (bad policy, missing target, bad arguments)
                """);
    }
}
