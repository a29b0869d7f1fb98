package com.psl.orchestrator.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.psl.orchestrator.api.dto.ExploreResponse;
import com.psl.orchestrator.api.dto.ResultHit;
import com.psl.orchestrator.api.dto.SearchRequest;
import com.psl.orchestrator.api.dto.SearchResponse;
import com.psl.orchestrator.api.dto.SummarizeRequest;
import com.psl.orchestrator.api.dto.SummarizeResponse;
import com.psl.orchestrator.service.InvalidRequestException;
import com.psl.orchestrator.service.ResearchSearchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(OrchestratorController.class)
class OrchestratorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResearchSearchService searchService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void searchReturnsFusedResults() throws Exception {
        ResultHit hit = new ResultHit();
        hit.setId("ABC12345");
        hit.setTitle("Trauma and Memory");
        hit.setScore(0.032);
        hit.setRank(1);
        hit.setFoundIn(List.of("vector", "metadata"));
        SearchResponse response = new SearchResponse();
        response.setMode("semantic");
        response.setConfidence(0.7);
        response.setBackendsUsed(List.of("vector", "metadata"));
        response.setExecution("parallel");
        response.setResults(List.of(hit));
        response.setTraceId("trace-1");
        response.setRequestId("req-1");
        when(searchService.search(
            argThat(request -> "trauma and memory".equals(request.getQuery())),
            eq("trace-1"),
            eq("req-1")
        )).thenReturn(response);

        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .header(RequestIdUtil.TRACE_HEADER, "trace-1")
                .header(RequestIdUtil.REQUEST_HEADER, "req-1")
                .content("{\"query\":\"trauma and memory\",\"limit\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("semantic"))
            .andExpect(jsonPath("$.backends_used[0]").value("vector"))
            .andExpect(jsonPath("$.results[0].id").value("ABC12345"))
            .andExpect(jsonPath("$.results[0].found_in.length()").value(2))
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.sub_queries").doesNotExist());
    }

    @Test
    void searchRejectsMissingBody() throws Exception {
        mockMvc.perform(post("/search").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("request body is required"))
            .andExpect(jsonPath("$.trace_id").isNotEmpty())
            .andExpect(jsonPath("$.request_id").isNotEmpty());
        verifyNoInteractions(searchService);
    }

    @Test
    void searchRejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("Invalid request body"));
    }

    @Test
    void invalidRequestMapsToBadRequest() throws Exception {
        when(searchService.search(any(SearchRequest.class), anyString(), anyString()))
            .thenThrow(new InvalidRequestException("query is required"));

        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .header(RequestIdUtil.REQUEST_HEADER, "req-2")
                .content("{\"query\":\" \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("query is required"))
            .andExpect(jsonPath("$.request_id").value("req-2"));
    }

    @Test
    void unexpectedFailureMapsToInternalError() throws Exception {
        when(searchService.search(any(SearchRequest.class), anyString(), anyString()))
            .thenThrow(new IllegalStateException("executor rejected task"));

        mockMvc.perform(post("/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"trauma\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("internal_error"))
            .andExpect(jsonPath("$.error.message").value("Unexpected error"));
    }

    @Test
    void summarizeReturnsContent() throws Exception {
        SummarizeResponse response = new SummarizeResponse();
        response.setItemId("ABC12345");
        response.setDepth("quick");
        response.setConfidence(1.0);
        response.setTokensEstimated(12);
        response.setContent("# Trauma and Memory");
        response.setSuccess(true);
        when(searchService.summarize(
            argThat(request -> "ABC12345".equals(request.getItemId()) && "quick".equals(request.getForceDepth())),
            anyString(),
            anyString()
        )).thenReturn(response);

        mockMvc.perform(post("/summarize")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"item_id\":\"ABC12345\",\"force_depth\":\"quick\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.depth").value("quick"))
            .andExpect(jsonPath("$.tokens_estimated").value(12))
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void exploreReturnsFailureWithSuggestion() throws Exception {
        ExploreResponse response = new ExploreResponse();
        response.setMode("collaboration");
        response.setSuccess(false);
        response.setError("collaboration exploration requires author");
        response.setSuggestion("Provide author or use a query like 'who collaborated with [author name]'");
        when(searchService.explore(
            argThat(request -> "collaboration".equals(request.getForceMode()) && Integer.valueOf(3).equals(request.getMaxHops())),
            anyString(),
            anyString()
        )).thenReturn(response);

        mockMvc.perform(post("/explore")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"network\",\"force_mode\":\"collaboration\",\"max_hops\":3}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.items_found").value(0))
            .andExpect(jsonPath("$.suggestion").isNotEmpty());
    }

    @Test
    void exploreRejectsMissingBody() throws Exception {
        mockMvc.perform(post("/explore").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
        verifyNoInteractions(searchService);
    }
}
