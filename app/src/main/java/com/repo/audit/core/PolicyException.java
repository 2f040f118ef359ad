package com.repo.audit.core;

/**
 * Raised when the audit policy cannot be loaded or fails validation.
 * A policy error aborts the run before any file is scanned.
 */
public class PolicyException extends Exception {

    public PolicyException(String message) {
        super(message);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
