package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Reference to an artifact produced alongside a test case.
 * Only the file path is recorded; content lives in result storage.
 */
public class TestEvidence {

    private final String evidenceId;
    private final String testCaseId;
    private final EvidenceType evidenceType;
    private final String filePath;
    private final Instant timestamp;
    private final String description;

    @JsonCreator
    public TestEvidence(@JsonProperty("evidenceId") String evidenceId,
                        @JsonProperty("testCaseId") String testCaseId,
                        @JsonProperty("evidenceType") EvidenceType evidenceType,
                        @JsonProperty("filePath") String filePath,
                        @JsonProperty("timestamp") Instant timestamp,
                        @JsonProperty("description") String description) {
        this.evidenceId = Objects.requireNonNull(evidenceId, "Evidence ID cannot be null");
        this.testCaseId = testCaseId;
        this.evidenceType = Objects.requireNonNull(evidenceType, "Evidence type cannot be null");
        this.filePath = Objects.requireNonNull(filePath, "File path cannot be null");
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.description = description;
    }

    public static TestEvidence of(TestCase testCase, EvidenceType type, String filePath, String description) {
        return new TestEvidence(UUID.randomUUID().toString(), testCase.getId(), type, filePath,
                                Instant.now(), description);
    }

    public String getEvidenceId() { return evidenceId; }
    public String getTestCaseId() { return testCaseId; }
    public EvidenceType getEvidenceType() { return evidenceType; }
    public String getFilePath() { return filePath; }
    public Instant getTimestamp() { return timestamp; }
    public String getDescription() { return description; }
}
