package com.enterprise.agentmarketplace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes what an agent pipeline operates on.
 * All fields are optional; each agent declares which ones it requires
 * through its metadata and enforces them while validating inputs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentInput {

    private final String sourceCode;
    private final String requirementsDoc;
    private final String frd;
    private final String brd;
    private final List<String> libraries;
    private final List<String> endpoints;
    private final Map<String, Object> apiSpecs;
    private final Map<String, String> apiKeys;
    private final String architectureDoc;
    private final Map<String, Object> config;

    @JsonCreator
    public AgentInput(@JsonProperty("sourceCode") String sourceCode,
                      @JsonProperty("requirementsDoc") String requirementsDoc,
                      @JsonProperty("frd") String frd,
                      @JsonProperty("brd") String brd,
                      @JsonProperty("libraries") List<String> libraries,
                      @JsonProperty("endpoints") List<String> endpoints,
                      @JsonProperty("apiSpecs") Map<String, Object> apiSpecs,
                      @JsonProperty("apiKeys") Map<String, String> apiKeys,
                      @JsonProperty("architectureDoc") String architectureDoc,
                      @JsonProperty("config") Map<String, Object> config) {
        this.sourceCode = sourceCode;
        this.requirementsDoc = requirementsDoc;
        this.frd = frd;
        this.brd = brd;
        this.libraries = copyOf(libraries);
        this.endpoints = copyOf(endpoints);
        this.apiSpecs = copyOf(apiSpecs);
        this.apiKeys = copyOf(apiKeys);
        this.architectureDoc = architectureDoc;
        this.config = copyOf(config);
    }

    public String getSourceCode() { return sourceCode; }
    public String getRequirementsDoc() { return requirementsDoc; }
    public String getFrd() { return frd; }
    public String getBrd() { return brd; }
    public List<String> getLibraries() { return libraries; }
    public List<String> getEndpoints() { return endpoints; }
    public Map<String, Object> getApiSpecs() { return apiSpecs; }
    public Map<String, String> getApiKeys() { return apiKeys; }
    public String getArchitectureDoc() { return architectureDoc; }
    public Map<String, Object> getConfig() { return config; }

    /**
     * Whether the named input field carries a usable value.
     * Blank strings and empty collections count as absent.
     */
    public boolean isProvided(String field) {
        switch (field) {
            case "source_code": return hasText(sourceCode);
            case "requirements_doc": return hasText(requirementsDoc);
            case "frd": return hasText(frd);
            case "brd": return hasText(brd);
            case "libraries": return libraries != null && !libraries.isEmpty();
            case "endpoints": return endpoints != null && !endpoints.isEmpty();
            case "api_specs": return apiSpecs != null && !apiSpecs.isEmpty();
            case "api_keys": return apiKeys != null && !apiKeys.isEmpty();
            case "architecture_doc": return hasText(architectureDoc);
            case "config": return config != null && !config.isEmpty();
            default: throw new IllegalArgumentException("Unknown input field: " + field);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
    }

    private static <K, V> Map<K, V> copyOf(Map<K, V> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static AgentInput empty() {
        return builder().build();
    }

    /**
     * Builder for creating AgentInput instances
     */
    public static class Builder {
        private String sourceCode;
        private String requirementsDoc;
        private String frd;
        private String brd;
        private List<String> libraries;
        private List<String> endpoints;
        private Map<String, Object> apiSpecs;
        private Map<String, String> apiKeys;
        private String architectureDoc;
        private Map<String, Object> config;

        public Builder sourceCode(String sourceCode) {
            this.sourceCode = sourceCode;
            return this;
        }

        public Builder requirementsDoc(String requirementsDoc) {
            this.requirementsDoc = requirementsDoc;
            return this;
        }

        public Builder frd(String frd) {
            this.frd = frd;
            return this;
        }

        public Builder brd(String brd) {
            this.brd = brd;
            return this;
        }

        public Builder libraries(List<String> libraries) {
            this.libraries = libraries;
            return this;
        }

        public Builder endpoints(List<String> endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public Builder apiSpecs(Map<String, Object> apiSpecs) {
            this.apiSpecs = apiSpecs;
            return this;
        }

        public Builder apiKeys(Map<String, String> apiKeys) {
            this.apiKeys = apiKeys;
            return this;
        }

        public Builder architectureDoc(String architectureDoc) {
            this.architectureDoc = architectureDoc;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public AgentInput build() {
            return new AgentInput(sourceCode, requirementsDoc, frd, brd, libraries, endpoints,
                                  apiSpecs, apiKeys, architectureDoc, config);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
