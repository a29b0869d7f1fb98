package com.psl.orchestrator.service;

import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.execution.Deadline;
import com.psl.orchestrator.execution.ExecutionCoordinator;
import com.psl.orchestrator.merge.FusedResult;
import com.psl.orchestrator.merge.RrfFusion;
import com.psl.orchestrator.plan.BackendPlanner;
import com.psl.orchestrator.plan.ExecutionPlan;
import com.psl.orchestrator.quality.QualityAssessor;
import com.psl.orchestrator.quality.QualityMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Escalator {
    private static final Logger log = LoggerFactory.getLogger(Escalator.class);

    private final BackendPlanner planner;
    private final ExecutionCoordinator coordinator;
    private final QualityAssessor assessor;
    private final OrchestrationSettings settings;
    private final MeterRegistry meterRegistry;

    public Escalator(
        BackendPlanner planner,
        ExecutionCoordinator coordinator,
        QualityAssessor assessor,
        OrchestrationSettings settings,
        MeterRegistry meterRegistry
    ) {
        this.planner = planner;
        this.coordinator = coordinator;
        this.assessor = assessor;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
    }

    public boolean shouldEscalate(OrchestrationPass pass) {
        return settings.isEscalationEnabled()
            && pass.canEscalate()
            && !pass.isTimedOut()
            && pass.getQuality().isEscalationRecommended();
    }

    /**
     * Runs the backends the pass has not used yet and fuses the original and new results together.
     * Returns the pass unchanged when no backend is left.
     */
    public OrchestrationPass escalate(OrchestrationPass pass, Deadline deadline) {
        ExecutionPlan additional = planner.planEscalation(pass.getPlan());
        if (additional == null) {
            log.debug("No backends left to escalate plan {}", pass.getPlan());
            return pass;
        }
        log.info(
            "Escalating {} ({}) with {}",
            pass.getPlan().getIntent().wireName(),
            pass.getQuality(),
            additional.getBackends()
        );
        meterRegistry.counter("orchestrator.escalations", "intent", pass.getPlan().getIntent().wireName()).increment();

        List<BackendResult> additionalResults = coordinator.execute(additional, deadline);
        List<BackendResult> combined = new ArrayList<>(pass.getResults());
        combined.addAll(additionalResults);
        FusedResult fused = RrfFusion.fuse(combined, settings.getRrfK());
        QualityMetrics quality = assessor.assess(fused, pass.getPlan().getRequestedLimit());
        return pass.escalate(additional, additionalResults, fused, quality);
    }
}
