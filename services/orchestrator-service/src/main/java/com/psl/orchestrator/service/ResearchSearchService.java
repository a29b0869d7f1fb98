package com.psl.orchestrator.service;

import com.psl.orchestrator.api.dto.ExploreRequest;
import com.psl.orchestrator.api.dto.ExploreResponse;
import com.psl.orchestrator.api.dto.ResultHit;
import com.psl.orchestrator.api.dto.SearchRequest;
import com.psl.orchestrator.api.dto.SearchResponse;
import com.psl.orchestrator.api.dto.SummarizeRequest;
import com.psl.orchestrator.api.dto.SummarizeResponse;
import com.psl.orchestrator.decompose.SubQuery;
import com.psl.orchestrator.explore.ExplorationRequest;
import com.psl.orchestrator.explore.ExplorationResult;
import com.psl.orchestrator.explore.ExplorationService;
import com.psl.orchestrator.merge.FusedEntry;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.query.Query;
import com.psl.orchestrator.query.QueryParams;
import com.psl.orchestrator.summarize.SummarizationService;
import com.psl.orchestrator.summarize.SummaryResult;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Maps the HTTP request and response bodies onto the orchestration, summarization and exploration services.
 */
@Service
public class ResearchSearchService {
    private final QueryOrchestrator orchestrator;
    private final SummarizationService summarizationService;
    private final ExplorationService explorationService;

    public ResearchSearchService(
        QueryOrchestrator orchestrator,
        SummarizationService summarizationService,
        ExplorationService explorationService
    ) {
        this.orchestrator = orchestrator;
        this.summarizationService = summarizationService;
        this.explorationService = explorationService;
    }

    public SearchResponse search(SearchRequest request, String traceId, String requestId) {
        String text = request.getQuery() == null ? "" : request.getQuery().trim();
        if (text.isEmpty()) {
            throw new InvalidRequestException("query is required");
        }
        if (request.getLimit() != null && request.getLimit() < 0) {
            throw new InvalidRequestException("limit must be positive");
        }
        Query query = Query.builder(text)
            .limit(request.getLimit())
            .forceMode(request.getForceMode())
            .params(QueryParams.of(
                request.getPaperId(),
                request.getAuthor(),
                request.getConcept(),
                request.getStartYear(),
                request.getEndYear(),
                request.getField()
            ))
            .timeoutMs(request.getTimeoutMs())
            .build();

        SearchOutcome outcome = orchestrator.orchestrate(query);
        return toResponse(outcome, traceId, requestId);
    }

    public SummarizeResponse summarize(SummarizeRequest request, String traceId, String requestId) {
        SummaryResult result = summarizationService.summarize(
            request.getItemId(),
            request.getQuery(),
            request.getForceDepth()
        );
        SummarizeResponse response = new SummarizeResponse();
        response.setItemId(result.getItemId());
        response.setDepth(result.getDepth().wireName());
        response.setConfidence(result.getConfidence());
        response.setTokensEstimated(result.isSuccess() ? result.getTokensEstimated() : null);
        response.setContent(result.getContent());
        response.setSuccess(result.isSuccess());
        response.setError(result.getError());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    public ExploreResponse explore(ExploreRequest request, String traceId, String requestId) {
        String text = request.getQuery() == null ? "" : request.getQuery().trim();
        QueryParams params = QueryParams.of(
            request.getPaperId(),
            request.getAuthor(),
            request.getConcept(),
            request.getStartYear(),
            request.getEndYear(),
            request.getField()
        );
        if (text.isEmpty() && params.isEmpty() && request.getForceMode() == null) {
            throw new InvalidRequestException("query or explicit parameters are required");
        }
        ExplorationResult result = explorationService.explore(new ExplorationRequest(
            text,
            params,
            request.getForceMode(),
            request.getLimit(),
            request.getMaxHops()
        ));
        ExploreResponse response = new ExploreResponse();
        response.setMode(result.getMode());
        response.setConfidence(result.getConfidence());
        response.setContent(result.getContent());
        response.setItemsFound(result.getItemsFound());
        response.setSuccess(result.isSuccess());
        response.setError(result.getError());
        response.setSuggestion(result.getSuggestion());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        return response;
    }

    static SearchResponse toResponse(SearchOutcome outcome, String traceId, String requestId) {
        SearchResponse response = new SearchResponse();
        response.setMode(outcome.getMode());
        response.setConfidence(outcome.getConfidence());
        response.setBackendsUsed(wireNames(outcome.getUsedBackends()));
        response.setBackendsPlanned(wireNames(outcome.getPlannedBackends()));
        response.setEscalated(outcome.isEscalated());
        response.setExecution(outcome.getExecution());
        response.setTimedOut(outcome.isTimedOut());
        response.setExpandedQuery(outcome.getExpandedQuery());

        if (outcome.getQuality() != null) {
            SearchResponse.Quality quality = new SearchResponse.Quality();
            quality.setConfidence(outcome.getQuality().getTier().wireName());
            quality.setCoverage(outcome.getQuality().getCoverage());
            response.setQuality(quality);
        }

        List<ResultHit> hits = new ArrayList<>();
        for (FusedEntry entry : outcome.getResults()) {
            ResultHit hit = new ResultHit();
            hit.setId(entry.getId());
            hit.setTitle(entry.getItem().getTitle());
            hit.setSnippet(entry.getItem().getSnippet());
            hit.setYear(entry.getItem().getYear());
            hit.setAuthors(entry.getItem().getAuthors());
            hit.setScore(entry.getScore());
            hit.setRank(entry.getRank());
            hit.setFoundIn(wireNames(entry.getBackends()));
            hits.add(hit);
        }
        response.setResults(hits);

        response.setDecomposed(outcome.isDecomposed());
        if (outcome.isDecomposed()) {
            List<SearchResponse.SubQueryView> views = new ArrayList<>();
            for (SubQuery subQuery : outcome.getSubQueries()) {
                SearchResponse.SubQueryView view = new SearchResponse.SubQueryView();
                view.setQuery(subQuery.getText());
                view.setWeight(subQuery.getWeight());
                view.setRole(subQuery.getRole().wireName());
                views.add(view);
            }
            response.setSubQueries(views);
        }
        response.setNoResults(outcome.isNoResults());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setTookMs(outcome.getTookMs());
        return response;
    }

    private static List<String> wireNames(List<Backend> backends) {
        List<String> names = new ArrayList<>();
        for (Backend backend : backends) {
            names.add(backend.wireName());
        }
        return names;
    }
}
