package com.psl.orchestrator.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "orchestrator")
public class OrchestrationProperties {
    private int defaultLimit = 10;
    private int maxLimit = 100;
    private int rrfK = 60;
    private double highConfidenceThreshold = 0.8;
    private double mediumConfidenceThreshold = 0.5;
    private double qualityThreshold = 0.5;
    private double minCoverage = 0.5;
    private int confidenceWindow = 5;
    private boolean escalationEnabled = true;
    private boolean decompositionEnabled = true;
    private boolean expansionEnabled = true;
    private int subQueryPoolSize = 5;
    private int backendPoolSize = 8;
    private int defaultTimeoutMs = 0;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public void setHighConfidenceThreshold(double highConfidenceThreshold) {
        this.highConfidenceThreshold = highConfidenceThreshold;
    }

    public double getMediumConfidenceThreshold() {
        return mediumConfidenceThreshold;
    }

    public void setMediumConfidenceThreshold(double mediumConfidenceThreshold) {
        this.mediumConfidenceThreshold = mediumConfidenceThreshold;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public void setQualityThreshold(double qualityThreshold) {
        this.qualityThreshold = qualityThreshold;
    }

    public double getMinCoverage() {
        return minCoverage;
    }

    public void setMinCoverage(double minCoverage) {
        this.minCoverage = minCoverage;
    }

    public int getConfidenceWindow() {
        return confidenceWindow;
    }

    public void setConfidenceWindow(int confidenceWindow) {
        this.confidenceWindow = confidenceWindow;
    }

    public boolean isEscalationEnabled() {
        return escalationEnabled;
    }

    public void setEscalationEnabled(boolean escalationEnabled) {
        this.escalationEnabled = escalationEnabled;
    }

    public boolean isDecompositionEnabled() {
        return decompositionEnabled;
    }

    public void setDecompositionEnabled(boolean decompositionEnabled) {
        this.decompositionEnabled = decompositionEnabled;
    }

    public boolean isExpansionEnabled() {
        return expansionEnabled;
    }

    public void setExpansionEnabled(boolean expansionEnabled) {
        this.expansionEnabled = expansionEnabled;
    }

    public int getSubQueryPoolSize() {
        return subQueryPoolSize;
    }

    public void setSubQueryPoolSize(int subQueryPoolSize) {
        this.subQueryPoolSize = subQueryPoolSize;
    }

    public int getBackendPoolSize() {
        return backendPoolSize;
    }

    public void setBackendPoolSize(int backendPoolSize) {
        this.backendPoolSize = backendPoolSize;
    }

    public int getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(int defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }
}
