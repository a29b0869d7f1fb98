package com.psl.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SummarizeRequest {
    @JsonProperty("item_id")
    private String itemId;

    private String query;

    @JsonProperty("force_depth")
    private String forceDepth;

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getForceDepth() {
        return forceDepth;
    }

    public void setForceDepth(String forceDepth) {
        this.forceDepth = forceDepth;
    }
}
