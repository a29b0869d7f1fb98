package com.psl.orchestrator.summarize;

public final class SummaryResult {
    private final String itemId;
    private final SummaryDepth depth;
    private final double confidence;
    private final String content;
    private final int tokensEstimated;
    private final boolean success;
    private final String error;

    private SummaryResult(
        String itemId,
        SummaryDepth depth,
        double confidence,
        String content,
        int tokensEstimated,
        boolean success,
        String error
    ) {
        this.itemId = itemId;
        this.depth = depth;
        this.confidence = confidence;
        this.content = content;
        this.tokensEstimated = tokensEstimated;
        this.success = success;
        this.error = error;
    }

    public static SummaryResult success(String itemId, SummaryDepth depth, double confidence, String content) {
        return new SummaryResult(itemId, depth, confidence, content, estimateTokens(content), true, null);
    }

    public static SummaryResult failure(String itemId, SummaryDepth depth, double confidence, String error) {
        return new SummaryResult(itemId, depth, confidence, null, 0, false, error);
    }

    /**
     * Roughly 1.3 tokens per whitespace-separated word.
     */
    public static int estimateTokens(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return (int) Math.round(content.trim().split("\\s+").length * 1.3);
    }

    public String getItemId() {
        return itemId;
    }

    public SummaryDepth getDepth() {
        return depth;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getContent() {
        return content;
    }

    public int getTokensEstimated() {
        return tokensEstimated;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }
}
