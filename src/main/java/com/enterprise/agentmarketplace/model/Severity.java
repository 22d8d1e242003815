package com.enterprise.agentmarketplace.model;

/**
 * Severity used for root cause analyses and recommendation priority
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
