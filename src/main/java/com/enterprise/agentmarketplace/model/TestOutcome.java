package com.enterprise.agentmarketplace.model;

/**
 * Outcome of an individual test case
 */
public enum TestOutcome {
    PASSED,
    FAILED,
    SKIPPED,
    ERROR
}
