package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Looks the company up on Portuguese Wikipedia and reads the CNPJ row of the article's infobox.
 */
@Component
public class EncyclopediaLayer implements ResolutionLayer {
    public static final String NAME = "encyclopedia";
    private static final Logger log = LoggerFactory.getLogger(EncyclopediaLayer.class);

    private final AntiBlockingHttpClient httpClient;
    private final ResolverProperties properties;
    private final ObjectMapper objectMapper;

    public EncyclopediaLayer(AntiBlockingHttpClient httpClient, ResolverProperties properties, ObjectMapper objectMapper) {
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
        FetchProfile profile = FetchProfile.encyclopediaApi(properties);
        String apiUrl = properties.getEncyclopedia().getApiUrl();

        JsonNode search = fetchJson(
            apiUrl + "?action=query&list=search&srsearch=" + encode(companyName) + "&format=json&srlimit=1",
            profile,
            token
        );
        if (search == null) {
            return LayerAttempt.unavailable(NAME, "Wikipedia search unavailable");
        }
        JsonNode hits = search.path("query").path("search");
        if (!hits.isArray() || hits.isEmpty()) {
            log.info("No Wikipedia page found for {}", companyName);
            return LayerAttempt.miss(NAME, null, "No Wikipedia page found");
        }
        String title = hits.get(0).path("title").asText("");
        if (title.isBlank()) {
            return LayerAttempt.miss(NAME, null, "No Wikipedia page found");
        }

        JsonNode parsed = fetchJson(
            apiUrl + "?action=parse&page=" + encode(title) + "&prop=text&format=json",
            profile,
            token
        );
        if (parsed == null) {
            return LayerAttempt.unavailable(NAME, "Wikipedia page " + title + " unavailable");
        }
        JsonNode html = parsed.path("parse").path("text").path("*");
        if (!html.isTextual()) {
            return LayerAttempt.miss(NAME, null, "Could not parse Wikipedia page");
        }

        String articleUrl = articleUrl(title);
        Element infobox = Jsoup.parse(html.asText()).selectFirst("table.infobox");
        if (infobox == null) {
            return LayerAttempt.miss(NAME, articleUrl, "No infobox found on Wikipedia page");
        }
        List<Cnpj> found = fromInfobox(infobox);
        if (found.isEmpty()) {
            log.info("Wikipedia page {} has no CNPJ in its infobox", title);
            return LayerAttempt.miss(NAME, articleUrl, "Wikipedia page found but no CNPJ in infobox");
        }
        log.info("Found {} CNPJ(s) on Wikipedia page {}", found.size(), title);
        return LayerAttempt.found(NAME, found, articleUrl, "Found on Wikipedia page " + title);
    }

    static List<Cnpj> fromInfobox(Element infobox) {
        Set<Cnpj> found = new LinkedHashSet<>();
        for (Element row : infobox.select("tr")) {
            Element header = row.selectFirst("th");
            if (header == null || !header.text().toLowerCase(Locale.ROOT).contains("cnpj")) {
                continue;
            }
            Element value = row.selectFirst("td");
            if (value != null) {
                found.addAll(Cnpj.findAll(value.text()));
            }
        }
        if (found.isEmpty()) {
            found.addAll(Cnpj.findAll(infobox.text()));
        }
        return new ArrayList<>(found);
    }

    String articleUrl(String title) {
        return properties.getEncyclopedia().getArticleBaseUrl() + title.replace(' ', '_');
    }

    private JsonNode fetchJson(String url, FetchProfile profile, CancellationToken token) {
        FetchResult fetch = httpClient.fetch(url, profile, token);
        if (!fetch.isSuccessful()) {
            log.warn("Wikipedia request failed ({}): {}", fetch.lastReason(), url);
            return null;
        }
        try {
            return objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            log.warn("Wikipedia returned invalid JSON for {}: {}", url, e.getOriginalMessage());
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
