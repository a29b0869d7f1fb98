package com.psl.orchestrator.backend;

import com.psl.orchestrator.plan.Backend;
import java.util.List;

public interface BackendAdapter {
    Backend backend();

    List<Item> retrieve(BackendCall call);
}
