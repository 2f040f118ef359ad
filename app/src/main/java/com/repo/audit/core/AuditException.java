package com.repo.audit.core;

/**
 * Operational failure that prevents an audit from running at all, such as a
 * missing target. Distinct from a failing verdict.
 */
public class AuditException extends Exception {

    public AuditException(String message) {
        super(message);
    }

    public AuditException(String message, Throwable cause) {
        super(message, cause);
    }
}
