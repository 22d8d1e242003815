package com.enterprise.agentmarketplace.model;

public enum EvidenceType {
    SCREENSHOT,
    LOG,
    RECORDING,
    REPORT,
    DATA
}
