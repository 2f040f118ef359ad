package com.repo.audit.analyzers;

import com.repo.audit.core.PolicyConfig;
import com.repo.audit.core.TechnicalLag;

import java.util.List;

/**
 * Flags files that still use deprecated APIs.
 * Presence/absence only: one match is enough for HIGH.
 */
public class LagDetector {

    public record LagResult(TechnicalLag level, List<String> instances) {
    }

    public LagResult detect(String path, List<String> lines, PolicyConfig policy) {
        List<String> instances = LineScanner.matchingLines(lines, policy.getLegacyApiPatterns()).stream()
                .map(line -> path + ":" + line)
                .toList();
        TechnicalLag level = instances.isEmpty() ? TechnicalLag.LOW : TechnicalLag.HIGH;
        return new LagResult(level, instances);
    }
}
