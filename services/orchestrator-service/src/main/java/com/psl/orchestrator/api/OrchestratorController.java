package com.psl.orchestrator.api;

import com.psl.orchestrator.api.dto.ErrorResponse;
import com.psl.orchestrator.api.dto.ExploreRequest;
import com.psl.orchestrator.api.dto.SearchRequest;
import com.psl.orchestrator.api.dto.SummarizeRequest;
import com.psl.orchestrator.service.InvalidRequestException;
import com.psl.orchestrator.service.ResearchSearchService;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OrchestratorController {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorController.class);

    private final ResearchSearchService searchService;

    public OrchestratorController(ResearchSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(
        @RequestBody(required = false) SearchRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return missingBody(traceId, requestId);
        }
        return handle(traceId, requestId, () -> searchService.search(request, traceId, requestId));
    }

    @PostMapping("/summarize")
    public ResponseEntity<?> summarize(
        @RequestBody(required = false) SummarizeRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return missingBody(traceId, requestId);
        }
        return handle(traceId, requestId, () -> searchService.summarize(request, traceId, requestId));
    }

    @PostMapping("/explore")
    public ResponseEntity<?> explore(
        @RequestBody(required = false) ExploreRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return missingBody(traceId, requestId);
        }
        return handle(traceId, requestId, () -> searchService.explore(request, traceId, requestId));
    }

    private ResponseEntity<?> handle(String traceId, String requestId, Supplier<?> call) {
        try {
            return ResponseEntity.ok(call.get());
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        } catch (Exception e) {
            log.error("Request {} failed", requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                new ErrorResponse("internal_error", "Unexpected error", traceId, requestId)
            );
        }
    }

    private static ResponseEntity<ErrorResponse> missingBody(String traceId, String requestId) {
        return ResponseEntity.badRequest().body(
            new ErrorResponse("bad_request", "request body is required", traceId, requestId)
        );
    }
}
