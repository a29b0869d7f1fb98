package com.psl.orchestrator.backend.metadata;

import com.psl.orchestrator.backend.BackendAdapter;
import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.query.QueryParams;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MetadataSearchAdapter implements BackendAdapter {
    static final String TEXT_MODE = "title_creator_year";

    private final MetadataSearchGateway gateway;

    public MetadataSearchAdapter(MetadataSearchGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Backend backend() {
        return Backend.METADATA;
    }

    @Override
    public List<Item> retrieve(BackendCall call) {
        return gateway.search(buildFilters(call), call.getLimit(), call.getTimeBudgetMs());
    }

    static Map<String, Object> buildFilters(BackendCall call) {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (call.getQueryText() != null && !call.getQueryText().isBlank()) {
            filters.put("q", call.getQueryText());
            filters.put("q_mode", TEXT_MODE);
        }
        QueryParams params = call.getParams();
        if (params != null) {
            if (params.getAuthor() != null) {
                filters.put("author", params.getAuthor());
            }
            if (params.hasYearRange()) {
                filters.put("year_from", params.getStartYear());
                filters.put("year_to", params.getEndYear());
            }
            if (params.getField() != null) {
                filters.put("field", params.getField());
            }
        }
        if (call.getFilters() != null) {
            filters.putAll(call.getFilters());
        }
        return filters;
    }
}
