package com.enterprise.agentmarketplace.storage;

/**
 * Statistics about the result storage.
 */
public class StorageStatistics {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final int totalExecutions;
    private final long resultsSizeBytes;
    private final long evidenceSizeBytes;
    private final int evidenceCount;

    public StorageStatistics(int totalExecutions, long resultsSizeBytes, long evidenceSizeBytes, int evidenceCount) {
        this.totalExecutions = totalExecutions;
        this.resultsSizeBytes = resultsSizeBytes;
        this.evidenceSizeBytes = evidenceSizeBytes;
        this.evidenceCount = evidenceCount;
    }

    public int getTotalExecutions() {
        return totalExecutions;
    }

    public long getResultsSizeBytes() {
        return resultsSizeBytes;
    }

    public long getEvidenceSizeBytes() {
        return evidenceSizeBytes;
    }

    public int getEvidenceCount() {
        return evidenceCount;
    }

    public double getTotalSizeMb() {
        return (resultsSizeBytes + evidenceSizeBytes) / BYTES_PER_MB;
    }

    @Override
    public String toString() {
        return "StorageStatistics{" +
                "totalExecutions=" + totalExecutions +
                ", resultsSizeBytes=" + resultsSizeBytes +
                ", evidenceSizeBytes=" + evidenceSizeBytes +
                ", evidenceCount=" + evidenceCount +
                '}';
    }
}
