package com.psl.orchestrator.service;

import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.merge.FusedResult;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.plan.ExecutionPlan;
import com.psl.orchestrator.quality.QualityMetrics;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One plan execution and its fused outcome. A pass may be escalated once; the escalated pass is terminal.
 */
public final class OrchestrationPass {
    public enum Stage {
        INITIAL,
        ESCALATED
    }

    private final Stage stage;
    private final ExecutionPlan plan;
    private final ExecutionPlan escalationPlan;
    private final List<BackendResult> results;
    private final FusedResult fused;
    private final QualityMetrics quality;

    private OrchestrationPass(
        Stage stage,
        ExecutionPlan plan,
        ExecutionPlan escalationPlan,
        List<BackendResult> results,
        FusedResult fused,
        QualityMetrics quality
    ) {
        this.stage = stage;
        this.plan = plan;
        this.escalationPlan = escalationPlan;
        this.results = List.copyOf(results);
        this.fused = fused;
        this.quality = quality;
    }

    public static OrchestrationPass initial(
        ExecutionPlan plan,
        List<BackendResult> results,
        FusedResult fused,
        QualityMetrics quality
    ) {
        return new OrchestrationPass(Stage.INITIAL, plan, null, results, fused, quality);
    }

    public OrchestrationPass escalate(
        ExecutionPlan additionalPlan,
        List<BackendResult> additionalResults,
        FusedResult escalatedFused,
        QualityMetrics escalatedQuality
    ) {
        if (stage != Stage.INITIAL) {
            throw new IllegalStateException("pass already escalated");
        }
        List<BackendResult> combined = new ArrayList<>(results);
        combined.addAll(additionalResults);
        return new OrchestrationPass(Stage.ESCALATED, plan, additionalPlan, combined, escalatedFused, escalatedQuality);
    }

    public boolean canEscalate() {
        return stage == Stage.INITIAL;
    }

    public boolean isEscalated() {
        return stage == Stage.ESCALATED;
    }

    public boolean isTimedOut() {
        for (BackendResult result : results) {
            if (result.isTimedOut()) {
                return true;
            }
        }
        return false;
    }

    public List<Backend> plannedBackends() {
        Set<Backend> planned = new LinkedHashSet<>(plan.getBackends());
        if (escalationPlan != null) {
            planned.addAll(escalationPlan.getBackends());
        }
        return new ArrayList<>(planned);
    }

    /**
     * Backends that answered without error, whether or not they returned items.
     */
    public List<Backend> respondingBackends() {
        Set<Backend> responding = new LinkedHashSet<>();
        for (BackendResult result : results) {
            if (!result.isError()) {
                responding.add(result.getBackend());
            }
        }
        return new ArrayList<>(responding);
    }

    public Stage getStage() {
        return stage;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public ExecutionPlan getEscalationPlan() {
        return escalationPlan;
    }

    public List<BackendResult> getResults() {
        return results;
    }

    public FusedResult getFused() {
        return fused;
    }

    public QualityMetrics getQuality() {
        return quality;
    }
}
