package com.psl.orchestrator.backend.vector;

import com.psl.orchestrator.backend.BackendAdapter;
import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class VectorSearchAdapter implements BackendAdapter {
    private final VectorSearchGateway gateway;

    public VectorSearchAdapter(VectorSearchGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Backend backend() {
        return Backend.VECTOR;
    }

    @Override
    public List<Item> retrieve(BackendCall call) {
        return gateway.search(call.getQueryText(), call.getLimit(), call.getFilters(), call.getTimeBudgetMs());
    }
}
