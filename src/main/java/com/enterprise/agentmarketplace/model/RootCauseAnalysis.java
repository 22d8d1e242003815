package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Structured explanation attached to a failing test case
 */
public class RootCauseAnalysis {

    private final String issueId;
    private final String category;
    private final String rootCause;
    private final List<String> affectedComponents;
    private final Severity severity;
    private final String stackTrace;

    @JsonCreator
    public RootCauseAnalysis(@JsonProperty("issueId") String issueId,
                             @JsonProperty("category") String category,
                             @JsonProperty("rootCause") String rootCause,
                             @JsonProperty("affectedComponents") List<String> affectedComponents,
                             @JsonProperty("severity") Severity severity,
                             @JsonProperty("stackTrace") String stackTrace) {
        this.issueId = Objects.requireNonNull(issueId, "Issue ID cannot be null");
        this.category = category;
        this.rootCause = rootCause;
        this.affectedComponents = affectedComponents != null ? List.copyOf(affectedComponents) : List.of();
        this.severity = severity != null ? severity : Severity.MEDIUM;
        this.stackTrace = stackTrace;
    }

    public String getIssueId() { return issueId; }
    public String getCategory() { return category; }
    public String getRootCause() { return rootCause; }
    public List<String> getAffectedComponents() { return affectedComponents; }
    public Severity getSeverity() { return severity; }
    public String getStackTrace() { return stackTrace; }
}
