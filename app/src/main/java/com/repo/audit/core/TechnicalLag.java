package com.repo.audit.core;

/**
 * Binary modernization flag: presence of deprecated-API usage.
 */
public enum TechnicalLag {
    LOW,
    HIGH
}
