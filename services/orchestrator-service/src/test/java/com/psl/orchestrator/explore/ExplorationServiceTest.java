package com.psl.orchestrator.explore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.orchestrator.backend.BackendUnavailableException;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.graph.GraphProperties;
import com.psl.orchestrator.backend.graph.GraphQueryGateway;
import com.psl.orchestrator.backend.graph.GraphQueryResult;
import com.psl.orchestrator.backend.graph.GraphStrategy;
import com.psl.orchestrator.backend.metadata.MetadataSearchGateway;
import com.psl.orchestrator.backend.vector.VectorSearchGateway;
import com.psl.orchestrator.intent.ExplorationClassifier;
import com.psl.orchestrator.query.QueryParams;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExplorationServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private GraphQueryGateway graphGateway;

    @Mock
    private MetadataSearchGateway metadataGateway;

    @Mock
    private VectorSearchGateway vectorGateway;

    private ExplorationService service;

    @BeforeEach
    void setUp() {
        service = new ExplorationService(
            new ExplorationClassifier(),
            graphGateway,
            metadataGateway,
            vectorGateway,
            new GraphProperties()
        );
    }

    @Test
    void collaborationRendersCollaborators() throws Exception {
        when(graphGateway.query(eq(GraphStrategy.COLLABORATION), any(QueryParams.class), anyString(), eq(10), eq(2), isNull()))
            .thenReturn(result(GraphStrategy.COLLABORATION,
                "{\"author\":\"Frank Putnam\",\"collaboration_hops\":1,\"collaboration_count\":3,"
                    + "\"sample_papers\":[\"Dissociation in Children\"]}"));

        ExplorationResult result = service.explore(request("who collaborated with Spiegel", QueryParams.empty(), null, null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMode()).isEqualTo("collaboration");
        assertThat(result.getConfidence()).isEqualTo(0.90);
        assertThat(result.getItemsFound()).isEqualTo(1);
        assertThat(result.getContent())
            .contains("# Collaborator Network for 'Spiegel'")
            .contains("## Frank Putnam")
            .contains("- **Collaboration Distance**: 1 hop\n")
            .contains("- **Shared Papers**: 3")
            .contains("  - Dissociation in Children");
    }

    @Test
    void explicitParametersWinOverExtractedOnes() throws Exception {
        when(graphGateway.query(eq(GraphStrategy.COLLABORATION), any(QueryParams.class), anyString(), eq(10), eq(3), isNull()))
            .thenReturn(result(GraphStrategy.COLLABORATION, "{\"author\":\"Someone\",\"collaboration_hops\":2}"));

        service.explore(request("who collaborated with Spiegel", QueryParams.empty().withAuthor("van der Kolk"), null, 3));

        ArgumentCaptor<QueryParams> params = ArgumentCaptor.forClass(QueryParams.class);
        verify(graphGateway).query(eq(GraphStrategy.COLLABORATION), params.capture(), anyString(), eq(10), eq(3), isNull());
        assertThat(params.getValue().getAuthor()).isEqualTo("van der Kolk");
    }

    @Test
    void missingParameterReturnsSuggestion() {
        ExplorationResult result = service.explore(request("show me the network", QueryParams.empty(), "collaboration", null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("author");
        assertThat(result.getSuggestion()).contains("who collaborated with");
        verifyNoInteractions(graphGateway);
    }

    @Test
    void temporalNeedsBothYears() {
        ExplorationResult result = service.explore(request(
            "trends",
            QueryParams.empty().withConcept("dissociation"),
            "temporal",
            null
        ));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSuggestion()).contains("from 2010 to 2024");
    }

    @Test
    void contentSimilarityExcludesReferenceItem() {
        Item reference = new Item("ABC12345", "Trauma and Memory", null, 2020, List.of("Spiegel"),
            Map.of("abstract", "Memory under stress."), null);
        when(metadataGateway.getItem("ABC12345")).thenReturn(Optional.of(reference));
        when(vectorGateway.search("Memory under stress.", 11)).thenReturn(List.of(
            new Item("ABC12345", "Trauma and Memory", null, 2020, null, null, 0.99),
            new Item("XYZ98765", "Stress and Recall", null, 2018, List.of("Putnam"), null, 0.81),
            new Item("QRS55555", "Encoding Under Threat", null, null, null, null, 0.77)
        ));

        ExplorationResult result = service.explore(request("find papers similar to ABC12345", QueryParams.empty(), null, null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMode()).isEqualTo("content_similarity");
        assertThat(result.getItemsFound()).isEqualTo(2);
        assertThat(result.getContent())
            .contains("# Papers Similar to: Trauma and Memory")
            .contains("## 1. Stress and Recall")
            .contains("- **Similarity Score**: 0.810")
            .doesNotContain("`ABC12345`");
        verifyNoInteractions(graphGateway);
    }

    @Test
    void contentSimilarityWithoutAbstractSuggestsRelatedMode() {
        when(metadataGateway.getItem("ABC12345")).thenReturn(Optional.of(Item.of("ABC12345", "Untitled draft")));

        ExplorationResult result = service.explore(request("find papers similar to ABC12345", QueryParams.empty(), null, null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSuggestion()).contains("related");
        verifyNoInteractions(vectorGateway);
    }

    @Test
    void comprehensiveCombinesStrategiesAndReportsFailures() throws Exception {
        when(graphGateway.query(eq(GraphStrategy.RELATED), any(QueryParams.class), anyString(), anyInt(), anyInt(), isNull()))
            .thenThrow(new BackendUnavailableException("graph store unavailable: 503"));
        when(graphGateway.query(eq(GraphStrategy.CITATION_CHAIN), any(QueryParams.class), anyString(), anyInt(), anyInt(), isNull()))
            .thenReturn(result(GraphStrategy.CITATION_CHAIN,
                "{\"id\":\"C1\",\"title\":\"Cited Work\",\"year\":2001,\"citation_hops\":2}"));
        when(graphGateway.query(eq(GraphStrategy.INFLUENCE), any(QueryParams.class), anyString(), anyInt(), anyInt(), isNull()))
            .thenReturn(result(GraphStrategy.INFLUENCE,
                "{\"id\":\"I1\",\"title\":\"Seminal Work\",\"year\":1990,\"influence_score\":0.42}"));

        ExplorationResult result = service.explore(request(
            "tell me about the library",
            QueryParams.empty().withPaperId("ABC12345"),
            null,
            null
        ));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMode()).isEqualTo("comprehensive");
        assertThat(result.getItemsFound()).isEqualTo(2);
        assertThat(result.getContent())
            .startsWith("# Comprehensive Graph Exploration")
            .contains("**Strategies executed**: citation, influence")
            .contains("# Citation Chain for ABC12345")
            .contains("- **Citation Distance**: 2 hops")
            .contains("- **Influence Score**: 0.42")
            .contains("## Warnings")
            .contains("related: graph store unavailable: 503");
    }

    @Test
    void comprehensiveFailsOnlyWhenEveryStrategyFails() {
        when(graphGateway.query(eq(GraphStrategy.INFLUENCE), any(QueryParams.class), anyString(), anyInt(), anyInt(), isNull()))
            .thenReturn(new GraphQueryResult(GraphStrategy.INFLUENCE, List.of(), List.of()));

        ExplorationResult result = service.explore(request("tell me about the library", QueryParams.empty(), null, null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("influence: no results");
    }

    @Test
    void unknownModeIsReported() {
        ExplorationResult result = service.explore(request("anything", QueryParams.empty(), "bogus", null));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Unknown mode: bogus");
        assertThat(result.getSuggestion()).contains("citation");
        verifyNoInteractions(graphGateway, metadataGateway, vectorGateway);
    }

    private static ExplorationRequest request(String text, QueryParams params, String forceMode, Integer maxHops) {
        return new ExplorationRequest(text, params, forceMode, null, maxHops);
    }

    private GraphQueryResult result(GraphStrategy strategy, String... records) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String record : records) {
            nodes.add(objectMapper.readTree(record));
        }
        return new GraphQueryResult(strategy, nodes, List.of());
    }
}
