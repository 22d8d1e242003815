package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered group of execution requests run either concurrently or one at a time.
 * Both flags default to {@code true}.
 */
public class BatchRequest {

    private final List<ExecutionRequest> executions;
    private final boolean parallel;
    private final boolean continueOnFailure;

    @JsonCreator
    public BatchRequest(@JsonProperty("executions") List<ExecutionRequest> executions,
                        @JsonProperty("parallel") Boolean parallel,
                        @JsonProperty("continueOnFailure") Boolean continueOnFailure) {
        this.executions = executions != null ? List.copyOf(executions) : List.of();
        this.parallel = parallel == null || parallel;
        this.continueOnFailure = continueOnFailure == null || continueOnFailure;
    }

    public List<ExecutionRequest> getExecutions() { return executions; }
    public boolean isParallel() { return parallel; }
    public boolean isContinueOnFailure() { return continueOnFailure; }

    /**
     * Builder for creating batch requests
     */
    public static class Builder {
        private final List<ExecutionRequest> executions = new ArrayList<>();
        private boolean parallel = true;
        private boolean continueOnFailure = true;

        public Builder add(ExecutionRequest request) {
            executions.add(request);
            return this;
        }

        public Builder add(AgentType agentType, AgentInput input) {
            return add(ExecutionRequest.of(agentType, input));
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(executions, parallel, continueOnFailure);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
