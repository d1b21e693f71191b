package com.delta.cnpjresolver.resolve.http;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.model.FetchStatus;
import com.delta.cnpjresolver.resolve.util.ReasonCodes;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Retry and classification policy for one kind of source.
 */
public record FetchProfile(
    String name,
    int maxAttempts,
    Duration minDelay,
    Duration maxDelay,
    Duration timeout,
    int minBodyLength,
    List<String> blockIndicators,
    List<String> expectedMarkers,
    Set<Integer> rotateStatuses,
    boolean useProxies,
    boolean randomizeHeaders,
    String userAgent,
    String accept
) {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String JSON_ACCEPT = "application/json";

    public FetchProfile {
        maxAttempts = Math.max(1, maxAttempts);
        minDelay = minDelay == null || minDelay.isNegative() ? Duration.ZERO : minDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(minDelay) < 0 ? minDelay : maxDelay;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(15) : timeout;
        minBodyLength = Math.max(0, minBodyLength);
        blockIndicators = lowercase(blockIndicators);
        expectedMarkers = lowercase(expectedMarkers);
        rotateStatuses = rotateStatuses == null ? Set.of() : Set.copyOf(rotateStatuses);
        userAgent = ResolverProperties.normalizeUserAgent(userAgent);
        accept = accept == null || accept.isBlank() ? "*/*" : accept;
    }

    public record Verdict(FetchStatus status, String reason) {
    }

    public Verdict classify(int statusCode, String body) {
        if (rotateStatuses.contains(statusCode)) {
            return new Verdict(FetchStatus.BLOCKED, ReasonCodes.fromHttpStatus(statusCode));
        }
        if (statusCode != 200) {
            return new Verdict(FetchStatus.TRANSIENT_ERROR, ReasonCodes.fromHttpStatus(statusCode));
        }
        String text = body == null ? "" : body;
        if (text.length() < minBodyLength) {
            return new Verdict(FetchStatus.BLOCKED, ReasonCodes.SHORT_BODY);
        }
        if (!blockIndicators.isEmpty() || !expectedMarkers.isEmpty()) {
            String lower = text.toLowerCase(Locale.ROOT);
            for (String indicator : blockIndicators) {
                if (lower.contains(indicator)) {
                    return new Verdict(FetchStatus.BLOCKED, ReasonCodes.BLOCK_INDICATOR);
                }
            }
            if (!expectedMarkers.isEmpty() && expectedMarkers.stream().noneMatch(lower::contains)) {
                return new Verdict(FetchStatus.BLOCKED, ReasonCodes.CONTENT_MARKER_MISSING);
            }
        }
        return new Verdict(FetchStatus.OK, ReasonCodes.OK);
    }

    public static FetchProfile directoryPage(ResolverProperties properties) {
        ResolverProperties.Http http = properties.getHttp();
        return new FetchProfile(
            "directory",
            http.getMaxAttempts(),
            Duration.ofMillis(http.getMinDelayMs()),
            Duration.ofMillis(http.getMaxDelayMs()),
            Duration.ofSeconds(http.getTimeoutSeconds()),
            http.getMinBodyLength(),
            http.getBlockIndicators(),
            properties.getBranches().getExpectedMarkers(),
            Set.copyOf(http.getRotateStatuses()),
            true,
            true,
            null,
            HTML_ACCEPT
        );
    }

    public static FetchProfile websiteCheck(ResolverProperties properties) {
        ResolverProperties.Website website = properties.getWebsite();
        return new FetchProfile(
            "website",
            1,
            Duration.ZERO,
            Duration.ZERO,
            Duration.ofSeconds(website.getTimeoutSeconds()),
            0,
            List.of(),
            List.of(),
            Set.of(),
            false,
            false,
            website.getUserAgent(),
            HTML_ACCEPT
        );
    }

    public static FetchProfile encyclopediaApi(ResolverProperties properties) {
        ResolverProperties.Encyclopedia encyclopedia = properties.getEncyclopedia();
        return jsonApi(
            "encyclopedia",
            encyclopedia.getMaxAttempts(),
            encyclopedia.getPauseMs(),
            encyclopedia.getTimeoutSeconds(),
            properties
        );
    }

    public static FetchProfile searchEngineApi(ResolverProperties properties) {
        ResolverProperties.SearchEngine searchEngine = properties.getSearchEngine();
        return jsonApi(
            "search-engine",
            searchEngine.getMaxAttempts(),
            searchEngine.getPauseMs(),
            searchEngine.getTimeoutSeconds(),
            properties
        );
    }

    public static FetchProfile registryApi(ResolverProperties properties) {
        ResolverProperties.Registry registry = properties.getRegistry();
        return jsonApi("registry", 1, 0, registry.getTimeoutSeconds(), properties);
    }

    private static FetchProfile jsonApi(
        String name,
        int maxAttempts,
        int delayMs,
        int timeoutSeconds,
        ResolverProperties properties
    ) {
        return new FetchProfile(
            name,
            maxAttempts,
            Duration.ofMillis(delayMs),
            Duration.ofMillis(delayMs),
            Duration.ofSeconds(timeoutSeconds),
            0,
            List.of(),
            List.of(),
            Set.of(429, 500, 502, 503, 504),
            false,
            false,
            properties.getWebsite().getUserAgent(),
            JSON_ACCEPT
        );
    }

    private static List<String> lowercase(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(value -> value.toLowerCase(Locale.ROOT))
            .toList();
    }
}
