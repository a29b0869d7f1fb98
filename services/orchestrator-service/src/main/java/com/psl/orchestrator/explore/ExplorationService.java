package com.psl.orchestrator.explore;

import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.graph.GraphProperties;
import com.psl.orchestrator.backend.graph.GraphQueryGateway;
import com.psl.orchestrator.backend.graph.GraphQueryResult;
import com.psl.orchestrator.backend.graph.GraphStrategy;
import com.psl.orchestrator.backend.metadata.MetadataSearchGateway;
import com.psl.orchestrator.backend.vector.VectorSearchGateway;
import com.psl.orchestrator.intent.Classification;
import com.psl.orchestrator.intent.ExplorationClassifier;
import com.psl.orchestrator.query.QueryParams;
import com.psl.orchestrator.summarize.MetadataFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ExplorationService {
    static final String MODES_HINT = "Use one of: citation, influence, content_similarity, related, "
        + "collaboration, concept, temporal, venue, comprehensive";
    static final Map<GraphStrategy, String> SUGGESTIONS = new EnumMap<>(GraphStrategy.class);

    static {
        SUGGESTIONS.put(GraphStrategy.CITATION_CHAIN,
            "Provide paper_id or use a query like 'papers citing ABC12345'");
        SUGGESTIONS.put(GraphStrategy.RELATED,
            "Provide paper_id or use a query like 'papers related to ABC12345'");
        SUGGESTIONS.put(GraphStrategy.CONTENT_SIMILARITY,
            "Provide paper_id or use a query like 'find papers similar to ABC12345'");
        SUGGESTIONS.put(GraphStrategy.COLLABORATION,
            "Provide author or use a query like 'who collaborated with [author name]'");
        SUGGESTIONS.put(GraphStrategy.CONCEPT_NETWORK,
            "Provide concept or use a query like 'concepts related to [concept]'");
        SUGGESTIONS.put(GraphStrategy.TEMPORAL,
            "Use a query like 'how did [topic] evolve from 2010 to 2024'");
    }

    private static final Logger log = LoggerFactory.getLogger(ExplorationService.class);

    private final ExplorationClassifier classifier;
    private final GraphQueryGateway graphGateway;
    private final MetadataSearchGateway metadataGateway;
    private final VectorSearchGateway vectorGateway;
    private final GraphProperties graphProperties;

    public ExplorationService(
        ExplorationClassifier classifier,
        GraphQueryGateway graphGateway,
        MetadataSearchGateway metadataGateway,
        VectorSearchGateway vectorGateway,
        GraphProperties graphProperties
    ) {
        this.classifier = classifier;
        this.graphGateway = graphGateway;
        this.metadataGateway = metadataGateway;
        this.vectorGateway = vectorGateway;
        this.graphProperties = graphProperties;
    }

    public ExplorationResult explore(ExplorationRequest request) {
        String forceMode = request.getForceMode();
        if (forceMode != null && !forceMode.isBlank() && GraphStrategy.fromString(forceMode) == null) {
            return ExplorationResult.failure(forceMode, null, "Unknown mode: " + forceMode, MODES_HINT);
        }
        Classification<GraphStrategy> classification = classifier.classify(request.getQueryText(), forceMode);
        GraphStrategy strategy = classification.getLabel();
        double confidence = classification.getConfidence();
        QueryParams params = request.getParams().orElse(classification.getParams());
        int maxHops = request.getMaxHops() > 0 ? request.getMaxHops() : graphProperties.getMaxHops();
        log.info("Exploring '{}' with strategy {} ({})", request.getQueryText(), strategy.wireName(), confidence);

        String missing = strategy.missingParameter(params);
        if (missing != null) {
            return ExplorationResult.failure(
                strategy.wireName(),
                confidence,
                strategy.wireName() + " exploration requires " + missing,
                SUGGESTIONS.get(strategy)
            );
        }

        try {
            switch (strategy) {
                case CONTENT_SIMILARITY:
                    return similar(params.getPaperId(), request.getLimit(), confidence);
                case COMPREHENSIVE:
                    return comprehensive(request, params, maxHops, confidence);
                default:
                    GraphQueryResult result = graphGateway.query(
                        strategy, params, request.getQueryText(), request.getLimit(), maxHops, null);
                    if (result.isEmpty()) {
                        return ExplorationResult.failure(
                            strategy.wireName(), confidence, "No " + strategy.wireName() + " results found", null);
                    }
                    String content = ExplorationRenderer.render(strategy, params, result.getRecords(), maxHops);
                    return ExplorationResult.success(strategy.wireName(), confidence, content, result.getRecords().size());
            }
        } catch (RuntimeException e) {
            log.warn("Exploration with strategy {} failed: {}", strategy.wireName(), e.getMessage(), e);
            return ExplorationResult.failure(strategy.wireName(), confidence, e.getMessage(), null);
        }
    }

    private ExplorationResult similar(String paperId, int limit, double confidence) {
        String mode = GraphStrategy.CONTENT_SIMILARITY.wireName();
        Optional<Item> reference = metadataGateway.getItem(paperId);
        if (reference.isEmpty()) {
            return ExplorationResult.failure(mode, confidence, "No item found with id: " + paperId, null);
        }
        String abstractText = MetadataFormatter.abstractOf(reference.get());
        if (abstractText == null) {
            return ExplorationResult.failure(mode, confidence, "Item " + paperId + " has no abstract to compare",
                "Use the related mode to find papers through shared entities");
        }
        List<Item> similar = new ArrayList<>();
        for (Item item : vectorGateway.search(abstractText, limit + 1)) {
            if (!paperId.equals(item.getId()) && similar.size() < limit) {
                similar.add(item);
            }
        }
        if (similar.isEmpty()) {
            return ExplorationResult.failure(mode, confidence, "No similar papers found for " + paperId, null);
        }
        return ExplorationResult.success(mode, confidence, ExplorationRenderer.similar(reference.get(), similar), similar.size());
    }

    private ExplorationResult comprehensive(ExplorationRequest request, QueryParams params, int maxHops, double confidence) {
        List<GraphStrategy> strategies = new ArrayList<>();
        if (params.getPaperId() != null) {
            strategies.add(GraphStrategy.RELATED);
            strategies.add(GraphStrategy.CITATION_CHAIN);
        }
        strategies.add(GraphStrategy.INFLUENCE);

        List<String> executed = new ArrayList<>();
        List<String> sections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int itemsFound = 0;
        for (GraphStrategy strategy : strategies) {
            try {
                GraphQueryResult result = graphGateway.query(
                    strategy, params, request.getQueryText(), request.getLimit(), maxHops, null);
                if (result.isEmpty()) {
                    warnings.add(strategy.wireName() + ": no results");
                    continue;
                }
                executed.add(strategy.wireName());
                sections.add(ExplorationRenderer.render(strategy, params, result.getRecords(), maxHops));
                itemsFound += result.getRecords().size();
            } catch (RuntimeException e) {
                log.warn("Comprehensive exploration step {} failed: {}", strategy.wireName(), e.getMessage());
                warnings.add(strategy.wireName() + ": " + e.getMessage());
            }
        }

        String mode = GraphStrategy.COMPREHENSIVE.wireName();
        if (sections.isEmpty()) {
            return ExplorationResult.failure(mode, confidence,
                "All exploration strategies failed: " + String.join("; ", warnings), null);
        }
        StringBuilder content = new StringBuilder();
        content.append("# Comprehensive Graph Exploration\n\n");
        content.append("**Strategies executed**: ").append(String.join(", ", executed)).append("\n\n");
        content.append(String.join("\n\n---\n\n", sections));
        if (!warnings.isEmpty()) {
            content.append("\n\n## Warnings\n\n");
            for (String warning : warnings) {
                content.append("- ").append(warning).append('\n');
            }
        }
        return ExplorationResult.success(mode, confidence, content.toString(), itemsFound);
    }
}
