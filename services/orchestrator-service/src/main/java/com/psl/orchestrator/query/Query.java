package com.psl.orchestrator.query;

public final class Query {
    private final String text;
    private final Integer limit;
    private final String forceMode;
    private final QueryParams params;
    private final Integer timeoutMs;

    private Query(Builder builder) {
        this.text = builder.text == null ? "" : builder.text.trim();
        this.limit = builder.limit;
        this.forceMode = builder.forceMode;
        this.params = builder.params == null ? QueryParams.empty() : builder.params;
        this.timeoutMs = builder.timeoutMs;
    }

    public static Builder builder(String text) {
        return new Builder(text);
    }

    public static Query of(String text) {
        return builder(text).build();
    }

    public String getText() {
        return text;
    }

    public Integer getLimit() {
        return limit;
    }

    public String getForceMode() {
        return forceMode;
    }

    public QueryParams getParams() {
        return params;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }

    public Builder toBuilder() {
        return new Builder(text)
            .limit(limit)
            .forceMode(forceMode)
            .params(params)
            .timeoutMs(timeoutMs);
    }

    public static final class Builder {
        private final String text;
        private Integer limit;
        private String forceMode;
        private QueryParams params;
        private Integer timeoutMs;

        private Builder(String text) {
            this.text = text;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder forceMode(String forceMode) {
            this.forceMode = forceMode;
            return this;
        }

        public Builder params(QueryParams params) {
            this.params = params;
            return this;
        }

        public Builder timeoutMs(Integer timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
