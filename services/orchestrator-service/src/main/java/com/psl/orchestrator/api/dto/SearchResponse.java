package com.psl.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private String mode;
    private double confidence;

    @JsonProperty("backends_used")
    private List<String> backendsUsed;

    @JsonProperty("backends_planned")
    private List<String> backendsPlanned;

    private boolean escalated;
    private String execution;

    @JsonProperty("timed_out")
    private boolean timedOut;

    @JsonProperty("expanded_query")
    private String expandedQuery;

    private Quality quality;
    private List<ResultHit> results;
    private boolean decomposed;

    @JsonProperty("sub_queries")
    private List<SubQueryView> subQueries;

    @JsonProperty("no_results")
    private boolean noResults;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("took_ms")
    private long tookMs;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public List<String> getBackendsUsed() {
        return backendsUsed;
    }

    public void setBackendsUsed(List<String> backendsUsed) {
        this.backendsUsed = backendsUsed;
    }

    public List<String> getBackendsPlanned() {
        return backendsPlanned;
    }

    public void setBackendsPlanned(List<String> backendsPlanned) {
        this.backendsPlanned = backendsPlanned;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public void setEscalated(boolean escalated) {
        this.escalated = escalated;
    }

    public String getExecution() {
        return execution;
    }

    public void setExecution(String execution) {
        this.execution = execution;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public void setTimedOut(boolean timedOut) {
        this.timedOut = timedOut;
    }

    public String getExpandedQuery() {
        return expandedQuery;
    }

    public void setExpandedQuery(String expandedQuery) {
        this.expandedQuery = expandedQuery;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    public List<ResultHit> getResults() {
        return results;
    }

    public void setResults(List<ResultHit> results) {
        this.results = results;
    }

    public boolean isDecomposed() {
        return decomposed;
    }

    public void setDecomposed(boolean decomposed) {
        this.decomposed = decomposed;
    }

    public List<SubQueryView> getSubQueries() {
        return subQueries;
    }

    public void setSubQueries(List<SubQueryView> subQueries) {
        this.subQueries = subQueries;
    }

    public boolean isNoResults() {
        return noResults;
    }

    public void setNoResults(boolean noResults) {
        this.noResults = noResults;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public static class Quality {
        private String confidence;
        private double coverage;

        public String getConfidence() {
            return confidence;
        }

        public void setConfidence(String confidence) {
            this.confidence = confidence;
        }

        public double getCoverage() {
            return coverage;
        }

        public void setCoverage(double coverage) {
            this.coverage = coverage;
        }
    }

    public static class SubQueryView {
        private String query;
        private double weight;
        private String role;

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }
    }
}
