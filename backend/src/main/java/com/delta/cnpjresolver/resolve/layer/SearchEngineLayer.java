package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.delta.cnpjresolver.resolve.util.ReasonCodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Google results through SerpAPI. Skipped when no API key is configured.
 */
@Component
public class SearchEngineLayer implements ResolutionLayer {
    public static final String NAME = "search-engine";
    private static final Logger log = LoggerFactory.getLogger(SearchEngineLayer.class);

    private final AntiBlockingHttpClient httpClient;
    private final ResolverProperties properties;
    private final ObjectMapper objectMapper;

    public SearchEngineLayer(AntiBlockingHttpClient httpClient, ResolverProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public LayerAttempt attempt(String companyName, CancellationToken token) {
        ResolverProperties.SearchEngine settings = properties.getSearchEngine();
        if (!settings.hasApiKey()) {
            return LayerAttempt.unavailable(NAME, "Skipped, " + ReasonCodes.NO_API_KEY);
        }
        String url = settings.getEndpoint()
            + "?engine=google&q=" + encode(companyName + " CNPJ")
            + "&hl=pt-BR&gl=br&api_key=" + encode(settings.getApiKey());
        FetchResult fetch = httpClient.fetch(url, FetchProfile.searchEngineApi(properties), token);
        if (!fetch.isSuccessful()) {
            log.warn("Search engine request for {} failed ({})", companyName, fetch.lastReason());
            return LayerAttempt.unavailable(NAME, "Search engine unavailable");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            log.warn("Search engine returned invalid JSON for {}: {}", companyName, e.getOriginalMessage());
            return LayerAttempt.unavailable(NAME, "Search engine returned invalid JSON");
        }
        if (root.hasNonNull("error")) {
            log.warn("Search engine error for {}: {}", companyName, root.path("error").asText());
            return LayerAttempt.unavailable(NAME, "Search engine error");
        }

        List<Cnpj> found = Cnpj.findAll(root.path("knowledge_graph").path("legal_identifier").asText(""));
        if (!found.isEmpty()) {
            return found(found, "knowledge graph");
        }

        JsonNode answerBox = root.path("answer_box");
        found = Cnpj.findAll(answerBox.path("snippet").asText("") + " " + answerBox.path("answer").asText(""));
        if (!found.isEmpty()) {
            return found(found, "answer box");
        }

        StringBuilder organic = new StringBuilder();
        int limit = settings.getMaxOrganicResults();
        int seen = 0;
        for (JsonNode item : root.path("organic_results")) {
            if (seen++ >= limit) {
                break;
            }
            organic.append(item.path("title").asText("")).append(' ')
                .append(item.path("snippet").asText("")).append('\n');
        }
        found = Cnpj.findAll(organic.toString());
        if (!found.isEmpty()) {
            return found(found, "organic results");
        }

        StringBuilder inline = new StringBuilder();
        for (JsonNode item : root.path("inline_results")) {
            inline.append(item.path("snippet").asText("")).append('\n');
        }
        found = Cnpj.findAll(inline.toString());
        if (!found.isEmpty()) {
            return found(found, "inline results");
        }
        return LayerAttempt.miss(NAME, null, "No CNPJ in search results");
    }

    private LayerAttempt found(List<Cnpj> candidates, String section) {
        // The request URL carries the API key, so it is never reported as a source.
        return LayerAttempt.found(NAME, candidates, null, "Found via search engine " + section);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
