package com.repo.audit.core;

/**
 * A single control-flow unit (method, constructor or initializer block)
 * extracted from a source file.
 */
public record SourceUnit(
        /** Unit name, e.g. "OrderService.checkout" */
        String name,

        /** First line of the declaration (1-based) */
        int startLine,

        /** Last line of the declaration (1-based) */
        int endLine,

        /** Cyclomatic complexity: 1 + decision points */
        int complexity) {
}
