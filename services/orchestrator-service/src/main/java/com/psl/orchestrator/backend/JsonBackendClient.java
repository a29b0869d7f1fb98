package com.psl.orchestrator.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * JSON-over-HTTP plumbing shared by the backend gateways.
 */
public class JsonBackendClient {
    private final String name;
    private final String baseUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public JsonBackendClient(String name, String baseUrl, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public JsonNode postJson(String path, Object body, Integer timeBudgetMs) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            String payload = objectMapper.writeValueAsString(body);
            HttpEntity<String> entity = new HttpEntity<>(payload, headers);
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response = client.exchange(url, HttpMethod.POST, entity, String.class);
            return readBody(response.getBody());
        } catch (ResourceAccessException e) {
            throw new BackendUnavailableException(name + " unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            throw translate(e);
        } catch (JsonProcessingException e) {
            throw new BackendRequestException("Failed to parse " + name + " response", e);
        }
    }

    /**
     * Returns null when the resource does not exist. {@code path} may be a URI template whose
     * {@code {placeholders}} are filled from {@code uriVariables} and encoded once.
     */
    public JsonNode getJson(String path, Integer timeBudgetMs, Object... uriVariables) {
        String url = buildUrl(path);
        try {
            RestTemplate client = restTemplateFor(timeBudgetMs);
            ResponseEntity<String> response =
                client.exchange(url, HttpMethod.GET, HttpEntity.EMPTY, String.class, uriVariables);
            return readBody(response.getBody());
        } catch (ResourceAccessException e) {
            throw new BackendUnavailableException(name + " unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 404) {
                return null;
            }
            throw translate(e);
        } catch (JsonProcessingException e) {
            throw new BackendRequestException("Failed to parse " + name + " response", e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private JsonNode readBody(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return objectMapper.readTree(body);
    }

    private RuntimeException translate(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        if (status == 502 || status == 503 || status == 504) {
            return new BackendUnavailableException(name + " unavailable: " + status, e);
        }
        return new BackendRequestException(name + " error: " + status, e);
    }

    private String buildUrl(String path) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new BackendUnavailableException(name + " base url missing");
        }
        String base = baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null || timeBudgetMs <= 0) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }
}
