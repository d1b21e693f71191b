package com.delta.cnpjresolver.resolve.layer;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.http.Sleeper;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.LayerAttempt;
import com.delta.cnpjresolver.resolve.util.SlugNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Guesses the company's corporate domains and scans the home page text for CNPJs.
 */
@Component
public class WebsiteLayer implements ResolutionLayer {
    public static final String NAME = "website";
    private static final Logger log = LoggerFactory.getLogger(WebsiteLayer.class);

    private final AntiBlockingHttpClient httpClient;
    private final ResolverProperties properties;
    private final Sleeper sleeper;

    public WebsiteLayer(AntiBlockingHttpClient httpClient, ResolverProperties properties, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    @Override
    public String name() {
        return NAME;
    }

    public static List<String> domainCandidates(String companyName) {
        String token = SlugNormalizer.domainToken(companyName);
        if (token.isEmpty()) {
            return List.of();
        }
        return List.of(
            token + ".com.br",
            token + ".com",
            token + ".br",
            "www." + token + ".com.br",
            "www." + token + ".com"
        );
    }

    @Override
    public LayerAttempt attempt(String companyName, CancellationToken token) {
        List<String> domains = domainCandidates(companyName);
        if (domains.isEmpty()) {
            return LayerAttempt.unavailable(NAME, "Could not generate domain candidates");
        }
        FetchProfile profile = FetchProfile.websiteCheck(properties);
        String scheme = properties.getWebsite().getScheme();
        Duration pause = Duration.ofMillis(properties.getWebsite().getPauseMs());
        boolean anyReachable = false;

        for (int i = 0; i < domains.size(); i++) {
            if (token != null && token.isCancelled()) {
                break;
            }
            if (i > 0 && !pause(pause)) {
                break;
            }
            String url = scheme + "://" + domains.get(i);
            FetchResult fetch = httpClient.fetch(url, profile, token);
            if (!fetch.isSuccessful()) {
                log.debug("Website candidate {} unavailable ({})", url, fetch.lastReason());
                continue;
            }
            anyReachable = true;
            List<Cnpj> found = Cnpj.findAll(visibleText(fetch.body()));
            if (!found.isEmpty()) {
                log.info("Found {} CNPJ(s) on {} for {}", found.size(), url, companyName);
                return LayerAttempt.found(NAME, found, url, "Found on website " + url);
            }
            log.debug("No CNPJ on {}", url);
        }
        if (!anyReachable) {
            return LayerAttempt.unavailable(NAME, "No valid website found");
        }
        return LayerAttempt.miss(NAME, null, "No CNPJ on website");
    }

    static String visibleText(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        document.select("script, style").remove();
        return document.text();
    }

    private boolean pause(Duration duration) {
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
