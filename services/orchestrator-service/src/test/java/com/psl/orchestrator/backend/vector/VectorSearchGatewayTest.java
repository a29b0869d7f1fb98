package com.psl.orchestrator.backend.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.orchestrator.backend.BackendRequestException;
import com.psl.orchestrator.backend.BackendUnavailableException;
import com.psl.orchestrator.backend.Item;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class VectorSearchGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void searchMapsResultsAndDropsDuplicateIds() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        VectorSearchGateway gateway = new VectorSearchGateway(restTemplate, objectMapper, properties("http://localhost:8000"));

        server.expect(requestTo("http://localhost:8000/search"))
            .andExpect(method(POST))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("query").asText()).isEqualTo("trauma and memory");
                assertThat(root.path("limit").asInt()).isEqualTo(5);
                assertThat(root.has("filters")).isFalse();
            })
            .andRespond(withSuccess(
                "{\"results\":["
                    + "{\"item_key\":\"ABC12345\",\"title\":\"Trauma and Memory\",\"score\":0.91,"
                    + "\"authors\":[\"Spiegel\",{\"name\":\"Putnam\"}],\"abstract\":\"Memory under stress.\"},"
                    + "{\"id\":\"ABC12345\",\"title\":\"Duplicate chunk\",\"score\":0.80},"
                    + "{\"title\":\"No identifier\"}"
                    + "]}",
                MediaType.APPLICATION_JSON
            ));

        List<Item> items = gateway.search("trauma and memory", 5);

        server.verify();
        assertThat(items).hasSize(1);
        Item item = items.get(0);
        assertThat(item.getId()).isEqualTo("ABC12345");
        assertThat(item.getAuthors()).containsExactly("Spiegel", "Putnam");
        assertThat(item.getRawScore()).isEqualTo(0.91);
        assertThat(item.getMetadata()).containsEntry("abstract", "Memory under stress.");
    }

    @Test
    void searchSendsFilters() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        VectorSearchGateway gateway = new VectorSearchGateway(restTemplate, objectMapper, properties("http://localhost:8000"));

        server.expect(requestTo("http://localhost:8000/search"))
            .andExpect(request -> {
                String body = ((MockClientHttpRequest) request).getBodyAsString(StandardCharsets.UTF_8);
                JsonNode root = objectMapper.readTree(body);
                assertThat(root.path("filters").path("parent_item_id").asText()).isEqualTo("ABC12345");
            })
            .andRespond(withSuccess("{\"results\":[]}", MediaType.APPLICATION_JSON));

        List<Item> items = gateway.search("sampling", 5, Map.of("parent_item_id", "ABC12345"), null);

        server.verify();
        assertThat(items).isEmpty();
    }

    @Test
    void blankQuerySkipsBackend() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        VectorSearchGateway gateway = new VectorSearchGateway(restTemplate, objectMapper, properties("http://localhost:8000"));

        assertThat(gateway.search("  ", 5)).isEmpty();
        assertThat(gateway.search("trauma", 0)).isEmpty();
        server.verify();
    }

    @Test
    void serviceUnavailableIsReportedAsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        VectorSearchGateway gateway = new VectorSearchGateway(restTemplate, objectMapper, properties("http://localhost:8000"));

        server.expect(requestTo("http://localhost:8000/search"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> gateway.search("trauma", 5))
            .isInstanceOf(BackendUnavailableException.class)
            .hasMessageContaining("503");
    }

    @Test
    void clientErrorIsReportedAsRequestFailure() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        VectorSearchGateway gateway = new VectorSearchGateway(restTemplate, objectMapper, properties("http://localhost:8000"));

        server.expect(requestTo("http://localhost:8000/search"))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> gateway.search("trauma", 5))
            .isInstanceOf(BackendRequestException.class)
            .hasMessageContaining("400");
    }

    @Test
    void missingBaseUrlIsReportedAsUnavailable() {
        VectorSearchGateway gateway = new VectorSearchGateway(new RestTemplate(), objectMapper, properties(null));

        assertThatThrownBy(() -> gateway.search("trauma", 5))
            .isInstanceOf(BackendUnavailableException.class)
            .hasMessageContaining("base url missing");
    }

    private VectorSearchProperties properties(String baseUrl) {
        VectorSearchProperties properties = new VectorSearchProperties();
        properties.setBaseUrl(baseUrl);
        return properties;
    }
}
