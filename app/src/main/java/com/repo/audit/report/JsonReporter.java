package com.repo.audit.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repo.audit.core.FileMetrics;
import com.repo.audit.rules.FileVerdict;
import com.repo.audit.rules.ProjectTotals;
import com.repo.audit.rules.ProjectVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Machine-readable audit report.
 * Field order is fixed so two runs over the same input produce the same document
 * apart from {@code generated_at}.
 */
public class JsonReporter {

    private static final Logger log = LoggerFactory.getLogger(JsonReporter.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public void write(AuditReport report, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toTree(report));
        }
        log.info("JSON report written to {}", outputPath.toAbsolutePath());
    }

    public String toJson(AuditReport report) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report));
    }

    ObjectNode toTree(AuditReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", AuditReport.VERSION);
        root.put("target", report.target());
        root.put("config_source", report.configSource());
        root.put("generated_at", report.generatedAt().toString());

        ArrayNode files = root.putArray("files");
        for (FileVerdict verdict : report.files()) {
            files.add(fileNode(verdict));
        }

        if (report.project() == null) {
            root.putNull("project");
        } else {
            root.set("project", projectNode(report.project()));
        }
        root.put("exit_code", report.exitCode());
        return root;
    }

    private ObjectNode fileNode(FileVerdict verdict) {
        FileMetrics m = verdict.metrics();
        ObjectNode node = mapper.createObjectNode();
        node.put("path", m.path());
        node.put("max_cc", m.maxCc());
        node.put("mean_cc", m.meanCc() == null ? null : round(m.meanCc(), 2));
        node.put("unit_count", m.unitCount());
        node.put("adf", round(m.adf(), 4));
        putIntegers(node.putArray("drift_lines"), m.driftLines());
        node.put("ccr", m.ccr() == null ? null : round(m.ccr(), 4));
        node.put("technical_lag", m.technicalLag().name());
        putStrings(node.putArray("tl_instances"), m.lagInstances());
        node.put("halstead_difficulty", round(m.halsteadDifficulty(), 2));
        node.put("halstead_effort", round(m.halsteadEffort(), 2));
        node.put("maintainability_index", round(m.maintainabilityIndex(), 2));
        node.put("failed", verdict.failed());
        node.put("degraded", verdict.degraded());
        putStrings(node.putArray("reasons"), verdict.reasons());
        return node;
    }

    private ObjectNode projectNode(ProjectVerdict project) {
        ProjectTotals t = project.totals();
        ObjectNode node = mapper.createObjectNode();
        node.put("total_files", t.totalFiles());
        node.put("max_cc_overall", t.maxCcOverall());
        node.put("mean_cc", round(t.meanCc(), 2));
        node.put("max_adf_overall", round(t.maxAdfOverall(), 4));
        putStrings(node.putArray("polluted_files"), t.pollutedFiles());
        node.put("mean_ccr", t.meanCcr() == null ? null : round(t.meanCcr(), 4));
        node.put("max_ccr", t.maxCcr() == null ? null : round(t.maxCcr(), 4));
        node.put("global_technical_lag", t.globalTechnicalLag().name());
        putStrings(node.putArray("tl_instances"), t.lagInstances());
        putStrings(node.putArray("unanalyzable_files"), t.unanalyzableFiles());
        node.put("failed", project.failed());
        putStrings(node.putArray("reasons"), project.reasons());
        return node;
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static void putIntegers(ArrayNode array, List<Integer> values) {
        values.forEach(array::add);
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
