package com.psl.orchestrator.summarize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.psl.orchestrator.backend.BackendUnavailableException;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.metadata.MetadataSearchGateway;
import com.psl.orchestrator.backend.vector.VectorSearchGateway;
import com.psl.orchestrator.service.InvalidRequestException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SummarizationServiceTest {

    private static final String ITEM_ID = "ABC12345";

    @Mock
    private MetadataSearchGateway metadataGateway;

    @Mock
    private VectorSearchGateway vectorGateway;

    private SummarizationService service;

    @BeforeEach
    void setUp() {
        service = new SummarizationService(new SummaryDepthClassifier(), metadataGateway, vectorGateway);
    }

    @Test
    void quickSummaryRendersMetadataAndAbstract() {
        when(metadataGateway.getItem(ITEM_ID)).thenReturn(Optional.of(item()));

        SummaryResult result = service.summarize(ITEM_ID, null, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDepth()).isEqualTo(SummaryDepth.QUICK);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getContent())
            .contains("# Trauma and Memory")
            .contains("**Authors:** Spiegel")
            .contains("## Abstract");
        assertThat(result.getTokensEstimated()).isEqualTo(SummaryResult.estimateTokens(result.getContent()));
    }

    @Test
    void unknownItemFails() {
        when(metadataGateway.getItem(ITEM_ID)).thenReturn(Optional.empty());

        SummaryResult result = service.summarize(ITEM_ID, "overview", "quick");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("No item found");
    }

    @Test
    void targetedSummarySearchesWithinTheItem() {
        String question = "what methodology did they use";
        when(vectorGateway.search(eq(question), eq(5), eq(Map.of("parent_item_id", ITEM_ID)), isNull()))
            .thenReturn(List.of(chunk("c1", "We ran a cohort study.", 0.91)));

        SummaryResult result = service.summarize(ITEM_ID, question, null);

        assertThat(result.getDepth()).isEqualTo(SummaryDepth.TARGETED);
        assertThat(result.getConfidence()).isEqualTo(0.80);
        assertThat(result.getContent())
            .contains("# Relevant Content for: " + question)
            .contains("(relevance: 0.91)")
            .contains("We ran a cohort study.");
    }

    @Test
    void forcedTargetedSummaryWithoutQuestionFailsBeforeSearching() {
        SummaryResult result = service.summarize(ITEM_ID, "  ", "targeted");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getDepth()).isEqualTo(SummaryDepth.TARGETED);
        assertThat(result.getError()).isEqualTo("Targeted Mode requires a specific question");
        verifyNoInteractions(vectorGateway, metadataGateway);
    }

    @Test
    void comprehensiveSummaryMarksMissingAspects() {
        when(metadataGateway.getItem(ITEM_ID)).thenReturn(Optional.of(item()));
        when(vectorGateway.search(anyString(), anyInt(), anyMap(), isNull())).thenReturn(List.of());

        SummaryResult result = service.summarize(ITEM_ID, null, "comprehensive");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContent())
            .contains("## Research Question")
            .contains("## Conclusions");
        assertThat(result.getContent().split("\\*No relevant content found\\*", -1)).hasSize(5);
        verify(vectorGateway, times(4)).search(anyString(), eq(5), anyMap(), isNull());
    }

    @Test
    void fullSummaryAppendsFullText() {
        when(metadataGateway.getItem(ITEM_ID)).thenReturn(Optional.of(item()));
        when(metadataGateway.getFullText(ITEM_ID)).thenReturn(Optional.of("Full body of the paper."));

        SummaryResult result = service.summarize(ITEM_ID, "get the full text of this paper", null);

        assertThat(result.getDepth()).isEqualTo(SummaryDepth.FULL);
        assertThat(result.getContent()).contains("## Full Text").endsWith("Full body of the paper.");
    }

    @Test
    void backendFailureBecomesFailedSummary() {
        when(metadataGateway.getItem(ITEM_ID)).thenThrow(new BackendUnavailableException("metadata service unavailable: 503"));

        SummaryResult result = service.summarize(ITEM_ID, null, null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("503");
    }

    @Test
    void invalidInputIsRejected() {
        assertThatThrownBy(() -> service.summarize(" ", null, null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.summarize(ITEM_ID, null, "deep")).isInstanceOf(InvalidRequestException.class);
    }

    private static Item item() {
        return new Item(
            ITEM_ID,
            "Trauma and Memory",
            null,
            2020,
            List.of("Spiegel"),
            Map.of("abstract", "Memory under stress."),
            null
        );
    }

    private static Item chunk(String id, String text, double score) {
        return new Item(id, null, text, null, null, Map.of("chunk_id", id), score);
    }
}
