package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Suggested remediation derived from a root cause analysis
 */
public class Recommendation {

    private final String recommendationId;
    private final String title;
    private final String description;
    private final String category;
    private final Severity priority;
    private final String suggestedFix;
    private final List<Map<String, String>> codeChanges;
    private final String relatedRca;

    @JsonCreator
    public Recommendation(@JsonProperty("recommendationId") String recommendationId,
                          @JsonProperty("title") String title,
                          @JsonProperty("description") String description,
                          @JsonProperty("category") String category,
                          @JsonProperty("priority") Severity priority,
                          @JsonProperty("suggestedFix") String suggestedFix,
                          @JsonProperty("codeChanges") List<Map<String, String>> codeChanges,
                          @JsonProperty("relatedRca") String relatedRca) {
        this.recommendationId = Objects.requireNonNull(recommendationId, "Recommendation ID cannot be null");
        this.title = title;
        this.description = description;
        this.category = category;
        this.priority = priority != null ? priority : Severity.MEDIUM;
        this.suggestedFix = suggestedFix;
        this.codeChanges = codeChanges != null ? List.copyOf(codeChanges) : List.of();
        this.relatedRca = relatedRca;
    }

    public String getRecommendationId() { return recommendationId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public Severity getPriority() { return priority; }
    public String getSuggestedFix() { return suggestedFix; }
    public List<Map<String, String>> getCodeChanges() { return codeChanges; }
    public String getRelatedRca() { return relatedRca; }
}
