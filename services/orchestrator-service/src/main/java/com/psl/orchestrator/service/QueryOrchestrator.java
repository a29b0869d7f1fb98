package com.psl.orchestrator.service;

import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.decompose.QueryDecomposer;
import com.psl.orchestrator.decompose.SubQuery;
import com.psl.orchestrator.execution.Deadline;
import com.psl.orchestrator.execution.ExecutionCoordinator;
import com.psl.orchestrator.intent.Classification;
import com.psl.orchestrator.intent.Intent;
import com.psl.orchestrator.intent.IntentClassifier;
import com.psl.orchestrator.merge.FusedResult;
import com.psl.orchestrator.merge.RrfFusion;
import com.psl.orchestrator.merge.WeightedMerge;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.plan.BackendPlanner;
import com.psl.orchestrator.plan.ExecutionPlan;
import com.psl.orchestrator.quality.QualityAssessor;
import com.psl.orchestrator.quality.QualityMetrics;
import com.psl.orchestrator.query.Query;
import com.psl.orchestrator.query.QueryExpander;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class QueryOrchestrator {
    static final int MAX_DECOMPOSITION_DEPTH = 1;
    static final int SUB_QUERY_LIMIT_MULTIPLIER = 2;

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final IntentClassifier classifier;
    private final QueryDecomposer decomposer;
    private final QueryExpander expander;
    private final BackendPlanner planner;
    private final ExecutionCoordinator coordinator;
    private final QualityAssessor assessor;
    private final Escalator escalator;
    private final OrchestrationSettings settings;
    private final ExecutorService subQueryExecutor;
    private final MeterRegistry meterRegistry;

    public QueryOrchestrator(
        IntentClassifier classifier,
        QueryDecomposer decomposer,
        QueryExpander expander,
        BackendPlanner planner,
        ExecutionCoordinator coordinator,
        QualityAssessor assessor,
        Escalator escalator,
        OrchestrationSettings settings,
        @Qualifier("subQueryExecutor") ExecutorService subQueryExecutor,
        MeterRegistry meterRegistry
    ) {
        this.classifier = classifier;
        this.decomposer = decomposer;
        this.expander = expander;
        this.planner = planner;
        this.coordinator = coordinator;
        this.assessor = assessor;
        this.escalator = escalator;
        this.settings = settings;
        this.subQueryExecutor = subQueryExecutor;
        this.meterRegistry = meterRegistry;
    }

    public SearchOutcome orchestrate(Query query) {
        long started = System.nanoTime();
        Deadline deadline = Deadline.afterMs(settings.resolveTimeoutMs(query.getTimeoutMs()));
        SearchOutcome outcome = orchestrate(query, 0, deadline, started);
        meterRegistry.timer(
            "orchestrator.pass.latency",
            "mode", outcome.getMode(),
            "decomposed", String.valueOf(outcome.isDecomposed())
        ).record(Duration.ofNanos(System.nanoTime() - started));
        log.info(
            "Query '{}' -> {} ({}), {} results, escalated={}, decomposed={}, took {}ms",
            query.getText(),
            outcome.getMode(),
            outcome.getExecution(),
            outcome.getResults().size(),
            outcome.isEscalated(),
            outcome.isDecomposed(),
            outcome.getTookMs()
        );
        return outcome;
    }

    private SearchOutcome orchestrate(Query query, int depth, Deadline deadline, long started) {
        int limit = settings.resolveLimit(query.getLimit());
        boolean forced = IntentClassifier.resolveForcedMode(query.getForceMode()) != null;
        Classification<Intent> classification = classifier.classify(query.getText(), query.getForceMode());
        classification = classification.withParams(query.getParams().orElse(classification.getParams()));

        if (depth < MAX_DECOMPOSITION_DEPTH && !forced && settings.isDecompositionEnabled()) {
            // Natural-language splits only apply to semantic queries; explicit AND/OR always split.
            List<SubQuery> subQueries = classification.getLabel().isDecomposable()
                ? decomposer.decompose(query.getText())
                : decomposer.decomposeExplicit(query.getText());
            if (subQueries.size() > 1) {
                return orchestrateDecomposed(query, classification, subQueries, limit, depth, deadline, started);
            }
        }

        String expandedText = null;
        if (depth == 0 && settings.isExpansionEnabled()) {
            expandedText = expander.expand(query.getText()).orElse(null);
            if (expandedText != null) {
                log.info("Query expanded: '{}' -> '{}'", query.getText(), expandedText);
            }
        }

        String searchText = expandedText == null ? query.getText() : expandedText;
        ExecutionPlan plan = planner.plan(searchText, classification, limit);
        List<BackendResult> results = coordinator.execute(plan, deadline);
        FusedResult fused = RrfFusion.fuse(results, settings.getRrfK());
        QualityMetrics quality = assessor.assess(fused, limit);
        OrchestrationPass pass = OrchestrationPass.initial(plan, results, fused, quality);

        if (depth == 0 && escalator.shouldEscalate(pass)) {
            pass = escalator.escalate(pass, deadline);
        } else if (pass.isTimedOut() && quality.isEscalationRecommended()) {
            log.info("Pass for '{}' timed out; returning partial results without escalation", query.getText());
        }

        return SearchOutcome.builder()
            .intent(classification.getLabel(), classification.getConfidence())
            .plannedBackends(pass.plannedBackends())
            .usedBackends(pass.respondingBackends())
            .execution(plan.getStrategy().wireName())
            .escalated(pass.isEscalated())
            .timedOut(pass.isTimedOut())
            .quality(pass.getQuality())
            .fused(pass.getFused(), limit)
            .expandedQuery(expandedText)
            .tookMs(elapsedMs(started))
            .build();
    }

    private SearchOutcome orchestrateDecomposed(
        Query query,
        Classification<Intent> classification,
        List<SubQuery> subQueries,
        int limit,
        int depth,
        Deadline deadline,
        long started
    ) {
        int subLimit = Math.min(settings.getMaxLimit(), limit * SUB_QUERY_LIMIT_MULTIPLIER);
        List<CompletableFuture<SearchOutcome>> futures = new ArrayList<>(subQueries.size());
        for (SubQuery subQuery : subQueries) {
            Query child = Query.builder(subQuery.getText())
                .limit(subLimit)
                .params(query.getParams())
                .build();
            futures.add(CompletableFuture.supplyAsync(
                () -> orchestrate(child, depth + 1, deadline, System.nanoTime()),
                subQueryExecutor
            ));
        }

        List<WeightedMerge.WeightedResult> parts = new ArrayList<>(subQueries.size());
        Set<Backend> planned = new LinkedHashSet<>();
        Set<Backend> used = new LinkedHashSet<>();
        boolean timedOut = false;
        for (int i = 0; i < subQueries.size(); i++) {
            SubQuery subQuery = subQueries.get(i);
            SearchOutcome sub = awaitSubQuery(subQuery, futures.get(i), deadline);
            if (sub == null) {
                timedOut = timedOut || deadline.isExpired();
                continue;
            }
            timedOut = timedOut || sub.isTimedOut();
            planned.addAll(sub.getPlannedBackends());
            used.addAll(sub.getUsedBackends());
            parts.add(new WeightedMerge.WeightedResult(subQuery.getWeight(), sub.getFused()));
        }

        FusedResult merged = WeightedMerge.merge(parts);
        QualityMetrics quality = assessor.assess(merged, limit);
        return SearchOutcome.builder()
            .intent(classification.getLabel(), classification.getConfidence())
            .plannedBackends(new ArrayList<>(planned))
            .usedBackends(new ArrayList<>(used))
            .execution(SearchOutcome.EXECUTION_DECOMPOSED)
            .escalated(false)
            .timedOut(timedOut)
            .quality(quality)
            .fused(merged, limit)
            .subQueries(subQueries)
            .tookMs(elapsedMs(started))
            .build();
    }

    private SearchOutcome awaitSubQuery(SubQuery subQuery, CompletableFuture<SearchOutcome> future, Deadline deadline) {
        try {
            Integer remaining = deadline.remainingMs();
            if (remaining != null) {
                return future.get(remaining, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            log.warn("Sub-query '{}' did not finish before the deadline", subQuery.getText());
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Sub-query '{}' failed: {}", subQuery.getText(), cause.getMessage(), cause);
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static long elapsedMs(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }
}
