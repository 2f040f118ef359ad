package com.repo.audit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Effective audit policy for one run.
 * Loaded from the nearest .policy.yaml above the target, or built-in defaults.
 * Immutable once constructed; shared read-only by all analyzer workers.
 */
public final class PolicyConfig {

    public static final String CONFIG_FILE_NAME = ".policy.yaml";
    public static final String DEFAULT_SOURCE = "<defaults>";

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    // Presentation and console I/O that has no place in business code
    static final List<String> DEFAULT_ILLEGAL_PATTERNS = List.of(
            "System\\.out\\.print",
            "System\\.err\\.print",
            "\\.printStackTrace\\(\\)",
            "import\\s+javax\\.swing\\.",
            "import\\s+java\\.awt\\.",
            "JOptionPane\\.",
            "new\\s+Scanner\\(\\s*System\\.in\\s*\\)");

    // java.io.File where java.nio.file.Path is the modern replacement
    static final List<String> DEFAULT_LEGACY_API_PATTERNS = List.of(
            "import\\s+java\\.io\\.File\\s*;",
            "new\\s+(java\\.io\\.)?File\\(");

    static final Set<String> DEFAULT_EXCLUDED_DIRS = Set.of(
            ".git", "target", "build", "out", "node_modules", ".idea");

    private static final Set<String> KNOWN_KEYS = Set.of(
            "max_cc", "adf_threshold", "ccr_threshold", "project_max_cc",
            "illegal_patterns", "legacy_api_patterns", "excluded_dirs",
            "churn_window_days", "churn_baseline_commits", "git_timeout_seconds", "parallelism");

    // Threshold defaults
    private int maxCc = 20;
    private double adfThreshold = 0.05;
    private double ccrThreshold = 0.3;
    private int projectMaxCc = 18;

    // Pattern sets
    private List<Pattern> illegalPatterns = compileDefaults(DEFAULT_ILLEGAL_PATTERNS);
    private List<Pattern> legacyApiPatterns = compileDefaults(DEFAULT_LEGACY_API_PATTERNS);
    private Set<String> excludedDirs = DEFAULT_EXCLUDED_DIRS;

    // Churn settings
    private int churnWindowDays = 14;
    private int churnBaselineCommits = 10;
    private int gitTimeoutSeconds = 5;

    private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    private String source = DEFAULT_SOURCE;

    private PolicyConfig() {
    }

    /**
     * Default configuration.
     */
    public static PolicyConfig defaults() {
        return new PolicyConfig();
    }

    /**
     * Resolve the policy for a target by searching its directory and each
     * ancestor for .policy.yaml. Falls back to defaults when none is found.
     */
    public static PolicyConfig load(Path target) throws PolicyException {
        Optional<Path> configFile = findConfigFile(target);
        if (configFile.isEmpty()) {
            log.info("No {} found above {}, using built-in defaults", CONFIG_FILE_NAME, target);
            return defaults();
        }
        return loadFile(configFile.get());
    }

    /**
     * Load an explicit policy file. A missing or malformed file is fatal.
     */
    public static PolicyConfig loadFile(Path configFile) throws PolicyException {
        if (!Files.isRegularFile(configFile)) {
            throw new PolicyException("Policy file not found: " + configFile);
        }

        Object data;
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            data = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new PolicyException("Malformed policy file " + configFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PolicyException("Could not read policy file " + configFile + ": " + e.getMessage(), e);
        }

        if (data == null) {
            log.info("Policy file {} is empty, using built-in defaults", configFile);
            PolicyConfig config = defaults();
            config.source = configFile.toString();
            return config;
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new PolicyException("Malformed policy file " + configFile + ": top level must be a mapping");
        }

        PolicyConfig config = fromMap(map, configFile.toString());
        log.info("Loaded policy from: {}", configFile);
        return config;
    }

    /**
     * Build a validated policy from already-parsed key/value pairs.
     */
    public static PolicyConfig fromMap(Map<?, ?> data, String source) throws PolicyException {
        PolicyConfig config = new PolicyConfig();
        config.source = source;
        config.parse(data);
        config.validate();
        return config;
    }

    static Optional<Path> findConfigFile(Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        Path dir = Files.isDirectory(absolute) ? absolute : absolute.getParent();

        while (dir != null) {
            Path candidate = dir.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            // Repository root: do not look outside the working tree
            if (Files.exists(dir.resolve(".git"))) {
                break;
            }
            dir = dir.getParent();
        }
        return Optional.empty();
    }

    private void parse(Map<?, ?> data) throws PolicyException {
        for (Object key : data.keySet()) {
            if (!KNOWN_KEYS.contains(String.valueOf(key))) {
                log.warn("Ignoring unknown policy key '{}' in {}", key, source);
            }
        }

        maxCc = getInt(data, "max_cc", maxCc);
        adfThreshold = getDouble(data, "adf_threshold", adfThreshold);
        ccrThreshold = getDouble(data, "ccr_threshold", ccrThreshold);
        projectMaxCc = getInt(data, "project_max_cc", projectMaxCc);

        illegalPatterns = getPatterns(data, "illegal_patterns", illegalPatterns);
        legacyApiPatterns = getPatterns(data, "legacy_api_patterns", legacyApiPatterns);

        List<String> dirs = getStringList(data, "excluded_dirs");
        if (dirs != null) {
            excludedDirs = Set.copyOf(dirs);
        }

        churnWindowDays = getInt(data, "churn_window_days", churnWindowDays);
        churnBaselineCommits = getInt(data, "churn_baseline_commits", churnBaselineCommits);
        gitTimeoutSeconds = getInt(data, "git_timeout_seconds", gitTimeoutSeconds);
        parallelism = getInt(data, "parallelism", parallelism);
    }

    private void validate() throws PolicyException {
        if (maxCc < 1) {
            throw invalid("max_cc must be at least 1, got " + maxCc);
        }
        if (projectMaxCc < 1) {
            throw invalid("project_max_cc must be at least 1, got " + projectMaxCc);
        }
        // The project ceiling may never be more lenient than the per-file one
        if (projectMaxCc > maxCc) {
            throw invalid("project_max_cc (" + projectMaxCc + ") must not exceed max_cc (" + maxCc + ")");
        }
        // NaN slips through every range comparison below
        if (!Double.isFinite(adfThreshold) || !Double.isFinite(ccrThreshold)) {
            throw invalid("adf_threshold and ccr_threshold must be finite numbers");
        }
        if (adfThreshold < 0.0 || adfThreshold > 1.0) {
            throw invalid("adf_threshold must be within [0, 1], got " + adfThreshold);
        }
        if (ccrThreshold < 0.0) {
            throw invalid("ccr_threshold must not be negative, got " + ccrThreshold);
        }
        if (churnWindowDays < 1 || churnBaselineCommits < 1 || gitTimeoutSeconds < 1 || parallelism < 1) {
            throw invalid("churn_window_days, churn_baseline_commits, git_timeout_seconds and parallelism"
                    + " must be positive");
        }
    }

    private PolicyException invalid(String detail) {
        return new PolicyException("Invalid policy " + source + ": " + detail);
    }

    private int getInt(Map<?, ?> map, String key, int defaultVal) throws PolicyException {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        if (val instanceof Integer || val instanceof Short)
            return ((Number) val).intValue();
        // SnakeYAML widens integers that do not fit an int to Long or BigInteger
        if (val instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE)
            return l.intValue();
        if (val instanceof Long || val instanceof BigInteger)
            throw invalid("'" + key + "' is out of range: " + val);
        throw invalid("'" + key + "' must be an integer, got: " + val);
    }

    private double getDouble(Map<?, ?> map, String key, double defaultVal) throws PolicyException {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        throw invalid("'" + key + "' must be a number, got: " + val);
    }

    private List<String> getStringList(Map<?, ?> map, String key) throws PolicyException {
        Object val = map.get(key);
        if (val == null)
            return null;
        if (!(val instanceof List<?> list)) {
            throw invalid("'" + key + "' must be a list of strings, got: " + val);
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw invalid("'" + key + "' must contain only strings, got: " + item);
            }
            result.add(s);
        }
        return result;
    }

    private List<Pattern> getPatterns(Map<?, ?> map, String key, List<Pattern> defaultVal) throws PolicyException {
        List<String> raw = getStringList(map, key);
        if (raw == null)
            return defaultVal;

        List<Pattern> compiled = new ArrayList<>();
        for (String regex : new LinkedHashSet<>(raw)) {
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw invalid("'" + key + "' contains an invalid regex '" + regex + "': " + e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    private static List<Pattern> compileDefaults(List<String> regexes) {
        return regexes.stream().map(Pattern::compile).toList();
    }

    // === Getters ===

    // Thresholds
    public int getMaxCc() {
        return maxCc;
    }

    public double getAdfThreshold() {
        return adfThreshold;
    }

    public double getCcrThreshold() {
        return ccrThreshold;
    }

    public int getProjectMaxCc() {
        return projectMaxCc;
    }

    // Patterns
    public List<Pattern> getIllegalPatterns() {
        return illegalPatterns;
    }

    public List<Pattern> getLegacyApiPatterns() {
        return legacyApiPatterns;
    }

    public Set<String> getExcludedDirs() {
        return excludedDirs;
    }

    // Churn
    public int getChurnWindowDays() {
        return churnWindowDays;
    }

    public int getChurnBaselineCommits() {
        return churnBaselineCommits;
    }

    public int getGitTimeoutSeconds() {
        return gitTimeoutSeconds;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Path of the policy file this config came from, or {@value #DEFAULT_SOURCE}.
     */
    public String getSource() {
        return source;
    }

    /**
     * True if any directory segment of the path is an excluded directory.
     */
    public boolean isExcluded(Path relativePath) {
        Path parent = relativePath.getParent();
        if (parent == null)
            return false;
        for (Path segment : parent) {
            if (excludedDirs.contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
