package com.psl.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ExploreRequest {
    private String query;

    @JsonProperty("paper_id")
    private String paperId;

    private String author;
    private String concept;

    @JsonProperty("start_year")
    private Integer startYear;

    @JsonProperty("end_year")
    private Integer endYear;

    private String field;

    @JsonProperty("force_mode")
    private String forceMode;

    private Integer limit;

    @JsonProperty("max_hops")
    private Integer maxHops;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getPaperId() {
        return paperId;
    }

    public void setPaperId(String paperId) {
        this.paperId = paperId;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getConcept() {
        return concept;
    }

    public void setConcept(String concept) {
        this.concept = concept;
    }

    public Integer getStartYear() {
        return startYear;
    }

    public void setStartYear(Integer startYear) {
        this.startYear = startYear;
    }

    public Integer getEndYear() {
        return endYear;
    }

    public void setEndYear(Integer endYear) {
        this.endYear = endYear;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getForceMode() {
        return forceMode;
    }

    public void setForceMode(String forceMode) {
        this.forceMode = forceMode;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getMaxHops() {
        return maxHops;
    }

    public void setMaxHops(Integer maxHops) {
        this.maxHops = maxHops;
    }
}
