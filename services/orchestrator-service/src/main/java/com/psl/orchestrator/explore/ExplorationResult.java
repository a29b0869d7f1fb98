package com.psl.orchestrator.explore;

public final class ExplorationResult {
    private final String mode;
    private final Double confidence;
    private final String content;
    private final int itemsFound;
    private final boolean success;
    private final String error;
    private final String suggestion;

    private ExplorationResult(
        String mode,
        Double confidence,
        String content,
        int itemsFound,
        boolean success,
        String error,
        String suggestion
    ) {
        this.mode = mode;
        this.confidence = confidence;
        this.content = content;
        this.itemsFound = itemsFound;
        this.success = success;
        this.error = error;
        this.suggestion = suggestion;
    }

    public static ExplorationResult success(String mode, double confidence, String content, int itemsFound) {
        return new ExplorationResult(mode, confidence, content, itemsFound, true, null, null);
    }

    public static ExplorationResult failure(String mode, Double confidence, String error, String suggestion) {
        return new ExplorationResult(mode, confidence, null, 0, false, error, suggestion);
    }

    public String getMode() {
        return mode;
    }

    public Double getConfidence() {
        return confidence;
    }

    public String getContent() {
        return content;
    }

    public int getItemsFound() {
        return itemsFound;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
