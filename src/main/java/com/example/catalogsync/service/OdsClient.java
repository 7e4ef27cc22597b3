package com.example.catalogsync.service;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.exception.RemoteException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the open-data portal explore API (v2.1).
 * Pages through results with limit/offset until an empty page is returned.
 */
@Service
public class OdsClient {

    private static final Logger log = LoggerFactory.getLogger(OdsClient.class);

    /** Upper bound of pages, guards against a portal that never returns an empty page */
    private static final int MAX_PAGES = 1000;

    private final SourceApiConfig config;
    private final WebClient webClient;

    public OdsClient(WebClient.Builder webClientBuilder, SourceApiConfig config) {
        this.config = config;
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getExploreApiUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * All records of a dataset matching an optional ODSQL where clause.
     */
    public List<JsonNode> fetchRecords(String datasetId, String where) {
        log.info("Fetching records of ODS dataset {}{}", datasetId, where == null || where.isBlank() ? "" : " where " + where);
        return fetchPaged("/catalog/datasets/" + datasetId + "/records", where, "fetchRecords");
    }

    /**
     * All dataset descriptions of the portal catalog, including their field definitions.
     */
    public List<JsonNode> fetchDatasets(String where) {
        log.info("Fetching ODS dataset catalog");
        return fetchPaged("/catalog/datasets", where, "fetchDatasets");
    }

    private List<JsonNode> fetchPaged(String path, String where, String operation) {
        int limit = config.getPageSize();
        List<JsonNode> results = new ArrayList<>();
        for (int page = 0; page < MAX_PAGES; page++) {
            int offset = page * limit;
            JsonNode response = get(path, where, limit, offset, operation);
            JsonNode pageResults = response == null ? null : response.path("results");
            if (pageResults == null || !pageResults.isArray() || pageResults.isEmpty()) {
                break;
            }
            pageResults.forEach(results::add);
            log.debug("Fetched {} results from {} (offset {})", pageResults.size(), path, offset);
        }
        log.info("Fetched {} results from {}", results.size(), path);
        return results;
    }

    private JsonNode get(String path, String where, int limit, int offset, String operation) {
        try {
            return webClient.get()
                    .uri(uriBuilder -> buildUri(uriBuilder, path, where, limit, offset))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("ODS API error on {}: {} - {}", path, e.getStatusCode(), e.getResponseBodyAsString());
            throw new RemoteException("ODS API error: " + e.getStatusCode() + " - " + e.getResponseBodyAsString(),
                    e.getStatusCode().value(), operation, e);
        } catch (WebClientException e) {
            throw new RemoteException("ODS request " + path + " failed: " + e.getMessage(), 503, operation, e);
        }
    }

    private URI buildUri(UriBuilder uriBuilder, String path, String where, int limit, int offset) {
        uriBuilder.path(path)
                .queryParam("limit", limit)
                .queryParam("offset", offset);
        if (where != null && !where.isBlank()) {
            uriBuilder.queryParam("where", "{where}");
            return uriBuilder.build(where);
        }
        return uriBuilder.build();
    }
}
