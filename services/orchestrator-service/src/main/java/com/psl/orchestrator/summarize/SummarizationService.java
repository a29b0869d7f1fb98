package com.psl.orchestrator.summarize;

import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.metadata.MetadataSearchGateway;
import com.psl.orchestrator.backend.vector.VectorSearchGateway;
import com.psl.orchestrator.intent.Classification;
import com.psl.orchestrator.service.InvalidRequestException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SummarizationService {
    static final String ITEM_FILTER = "parent_item_id";
    static final int TARGETED_TOP_K = 5;
    static final int ASPECT_TOP_K = 3;
    static final String NO_CONTENT = "*No relevant content found*";

    static final List<Aspect> ASPECTS = List.of(
        new Aspect("Research Question", "What is the main research question or objective of this study?"),
        new Aspect("Methodology", "What methodology or approach did the researchers use?"),
        new Aspect("Findings", "What were the main findings or results?"),
        new Aspect("Conclusions", "What conclusions or implications did the authors draw?")
    );

    private static final Logger log = LoggerFactory.getLogger(SummarizationService.class);

    private final SummaryDepthClassifier depthClassifier;
    private final MetadataSearchGateway metadataGateway;
    private final VectorSearchGateway vectorGateway;

    public SummarizationService(
        SummaryDepthClassifier depthClassifier,
        MetadataSearchGateway metadataGateway,
        VectorSearchGateway vectorGateway
    ) {
        this.depthClassifier = depthClassifier;
        this.metadataGateway = metadataGateway;
        this.vectorGateway = vectorGateway;
    }

    public SummaryResult summarize(String itemId, String query, String forceDepth) {
        if (itemId == null || itemId.isBlank()) {
            throw new InvalidRequestException("item_id is required");
        }
        Classification<SummaryDepth> classification = resolveDepth(query, forceDepth);
        SummaryDepth depth = classification.getLabel();
        double confidence = classification.getConfidence();
        log.info("Summarizing {} at depth {} ({})", itemId, depth.wireName(), confidence);

        try {
            switch (depth) {
                case FULL:
                    return full(itemId, confidence);
                case COMPREHENSIVE:
                    return comprehensive(itemId, confidence);
                case TARGETED:
                    return targeted(itemId, query, confidence);
                case QUICK:
                default:
                    return quick(itemId, confidence);
            }
        } catch (RuntimeException e) {
            log.warn("Summary of {} at depth {} failed: {}", itemId, depth.wireName(), e.getMessage(), e);
            return SummaryResult.failure(itemId, depth, confidence, e.getMessage());
        }
    }

    Classification<SummaryDepth> resolveDepth(String query, String forceDepth) {
        if (forceDepth != null && !forceDepth.isBlank()) {
            SummaryDepth forced = SummaryDepth.fromString(forceDepth);
            if (forced == null) {
                throw new InvalidRequestException(
                    "unknown depth '" + forceDepth.toLowerCase(Locale.ROOT) + "'; expected quick, targeted, comprehensive or full"
                );
            }
            return Classification.forced(forced, null);
        }
        return depthClassifier.classify(query);
    }

    private SummaryResult quick(String itemId, double confidence) {
        Optional<Item> item = metadataGateway.getItem(itemId);
        if (item.isEmpty()) {
            return SummaryResult.failure(itemId, SummaryDepth.QUICK, confidence, "No item found with id: " + itemId);
        }
        return SummaryResult.success(itemId, SummaryDepth.QUICK, confidence, MetadataFormatter.format(item.get(), true));
    }

    private SummaryResult targeted(String itemId, String question, double confidence) {
        if (question == null || question.isBlank()) {
            return SummaryResult.failure(
                itemId, SummaryDepth.TARGETED, confidence, "Targeted Mode requires a specific question");
        }
        List<Item> chunks = searchWithinItem(itemId, question, TARGETED_TOP_K);
        if (chunks.isEmpty()) {
            return SummaryResult.failure(itemId, SummaryDepth.TARGETED, confidence, "No relevant content found in this item");
        }
        StringBuilder out = new StringBuilder();
        out.append("# Relevant Content for: ").append(question).append('\n');
        for (int i = 0; i < chunks.size(); i++) {
            Item chunk = chunks.get(i);
            out.append("\n## Chunk ").append(i + 1);
            if (chunk.getRawScore() != null) {
                out.append(String.format(Locale.ROOT, " (relevance: %.2f)", chunk.getRawScore()));
            }
            out.append('\n');
            out.append(chunkText(chunk)).append("\n\n---\n");
        }
        return SummaryResult.success(itemId, SummaryDepth.TARGETED, confidence, out.toString());
    }

    private SummaryResult comprehensive(String itemId, double confidence) {
        Optional<Item> item = metadataGateway.getItem(itemId);
        if (item.isEmpty()) {
            return SummaryResult.failure(
                itemId, SummaryDepth.COMPREHENSIVE, confidence, "No item found with id: " + itemId);
        }
        StringBuilder out = new StringBuilder();
        out.append("# Comprehensive Summary\n\n## Bibliographic Information\n\n");
        out.append(MetadataFormatter.format(item.get(), true));
        out.append("\n---\n");
        for (Aspect aspect : ASPECTS) {
            out.append("\n## ").append(aspect.name).append("\n\n");
            List<Item> chunks;
            try {
                chunks = searchWithinItem(itemId, aspect.question, TARGETED_TOP_K);
            } catch (RuntimeException e) {
                log.warn("Aspect '{}' of {} unavailable: {}", aspect.name, itemId, e.getMessage());
                chunks = List.of();
            }
            if (chunks.isEmpty()) {
                out.append(NO_CONTENT).append('\n');
                continue;
            }
            List<Item> top = chunks.subList(0, Math.min(ASPECT_TOP_K, chunks.size()));
            if (top.get(0).getRawScore() != null) {
                out.append(String.format(Locale.ROOT, "*Relevance: %.2f*%n%n", top.get(0).getRawScore()));
            }
            for (Item chunk : top) {
                out.append(chunkText(chunk)).append("\n\n");
            }
            out.append("---\n");
        }
        return SummaryResult.success(itemId, SummaryDepth.COMPREHENSIVE, confidence, out.toString());
    }

    private SummaryResult full(String itemId, double confidence) {
        Optional<Item> item = metadataGateway.getItem(itemId);
        if (item.isEmpty()) {
            return SummaryResult.failure(itemId, SummaryDepth.FULL, confidence, "No item found with id: " + itemId);
        }
        Optional<String> fullText = metadataGateway.getFullText(itemId);
        if (fullText.isEmpty()) {
            return SummaryResult.failure(itemId, SummaryDepth.FULL, confidence, "No full text available for " + itemId);
        }
        String content = MetadataFormatter.format(item.get(), true) + "\n---\n\n## Full Text\n\n" + fullText.get();
        return SummaryResult.success(itemId, SummaryDepth.FULL, confidence, content);
    }

    private List<Item> searchWithinItem(String itemId, String question, int topK) {
        return vectorGateway.search(question, topK, Map.of(ITEM_FILTER, itemId), null);
    }

    private static String chunkText(Item chunk) {
        return chunk.getSnippet() == null ? "" : chunk.getSnippet();
    }

    static final class Aspect {
        private final String name;
        private final String question;

        Aspect(String name, String question) {
            this.name = name;
            this.question = question;
        }
    }
}
