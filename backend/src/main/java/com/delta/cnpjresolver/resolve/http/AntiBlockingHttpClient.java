package com.delta.cnpjresolver.resolve.http;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.model.FetchStatus;
import com.delta.cnpjresolver.resolve.model.PageFetchOutcome;
import com.delta.cnpjresolver.resolve.util.ReasonCodes;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.Authenticator;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * GET client that retries through rotating proxies with randomized headers until a page passes
 * the profile's block checks. Failures are reported as {@link FetchResult} values, never thrown.
 */
@Service
public class AntiBlockingHttpClient {
    private static final Logger log = LoggerFactory.getLogger(AntiBlockingHttpClient.class);
    private static final String REFERER_PREFIX = "https://www.google.com/search?q=";
    private static final Pattern SECRET_PARAM = Pattern.compile("(?i)((?:api_key|key|token)=)[^&]*");

    private final ResolverProperties properties;
    private final ProxyPool proxyPool;
    private final Sleeper sleeper;
    private final ExecutorService httpExecutor;
    private final HttpClient directClient;
    private final Map<ProxyEndpoint, HttpClient> proxyClients = new ConcurrentHashMap<>();

    public AntiBlockingHttpClient(
        ResolverProperties properties,
        ProxyPool proxyPool,
        Sleeper sleeper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.proxyPool = proxyPool;
        this.sleeper = sleeper;
        this.httpExecutor = httpExecutor;
        this.directClient = buildClient(null);
    }

    public FetchResult fetch(String url, FetchProfile profile, CancellationToken token) {
        CancellationToken effectiveToken = token == null ? CancellationToken.none() : token;
        List<PageFetchOutcome> attempts = new ArrayList<>();
        URI uri = normalizeUri(url);
        if (uri == null) {
            attempts.add(new PageFetchOutcome(url, 0, null, FetchStatus.FATAL_ERROR, null, Duration.ZERO, ReasonCodes.INVALID_URL));
            log.warn("Refusing to fetch malformed url {}", redact(url));
            return new FetchResult(url, null, attempts, false);
        }

        for (int attempt = 1; attempt <= profile.maxAttempts(); attempt++) {
            if (effectiveToken.isCancelled()) {
                log.debug("Fetch of {} stopped before attempt {}: {}", redact(url), attempt, effectiveToken.reason());
                return new FetchResult(url, null, attempts, true);
            }
            if (!sleepBeforeAttempt(profile)) {
                return new FetchResult(url, null, attempts, true);
            }
            Optional<ProxyEndpoint> proxy = profile.useProxies() ? proxyPool.next() : Optional.empty();
            PageFetchOutcome outcome = executeOnce(uri, url, profile, proxy.orElse(null));
            attempts.add(outcome);
            log.debug(
                "Attempt {}/{} [{}] {} -> status={} class={} reason={} proxy={}",
                attempt,
                profile.maxAttempts(),
                profile.name(),
                redact(url),
                outcome.statusCode(),
                outcome.status(),
                outcome.reason(),
                outcome.proxy() == null ? "direct" : outcome.proxy()
            );
            if (outcome.isOk()) {
                return new FetchResult(url, outcome, attempts, false);
            }
            if (outcome.isFatal()) {
                return new FetchResult(url, null, attempts, false);
            }
            if (Thread.currentThread().isInterrupted()) {
                return new FetchResult(url, null, attempts, true);
            }
        }
        log.warn(
            "Source unavailable after {} attempts [{}] {} (last reason {})",
            attempts.size(),
            profile.name(),
            redact(url),
            attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).reason()
        );
        return new FetchResult(url, null, attempts, false);
    }

    private PageFetchOutcome executeOnce(URI uri, String url, FetchProfile profile, ProxyEndpoint proxy) {
        Instant startedAt = Instant.now();
        String proxyLabel = proxy == null ? null : proxy.label();
        try {
            HttpRequest request = buildRequest(uri, profile);
            HttpClient client = proxy == null ? directClient : proxyClients.computeIfAbsent(proxy, this::buildClient);
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            String body = decodeBody(response.body(), response.headers().firstValue("Content-Type").orElse(null));
            FetchProfile.Verdict verdict = profile.classify(response.statusCode(), body);
            return new PageFetchOutcome(
                url,
                response.statusCode(),
                body,
                verdict.status(),
                proxyLabel,
                Duration.between(startedAt, Instant.now()),
                verdict.reason()
            );
        } catch (IOException e) {
            return errorOutcome(url, startedAt, proxyLabel, FetchStatus.TRANSIENT_ERROR, ReasonCodes.fromException(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorOutcome(url, startedAt, proxyLabel, FetchStatus.TRANSIENT_ERROR, ReasonCodes.INTERRUPTED);
        } catch (IllegalArgumentException e) {
            return errorOutcome(url, startedAt, proxyLabel, FetchStatus.FATAL_ERROR, ReasonCodes.INVALID_URL);
        }
    }

    private HttpRequest buildRequest(URI uri, FetchProfile profile) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(profile.timeout())
            .header("Accept", profile.accept());
        if (profile.randomizeHeaders()) {
            builder.header("User-Agent", pick(properties.getHttp().getUserAgents(), profile.userAgent()))
                .header("Accept-Language", pick(properties.getHttp().getAcceptLanguages(), "pt-BR,pt;q=0.9"))
                .header("Referer", refererFor(uri));
        } else {
            builder.header("User-Agent", profile.userAgent())
                .header("Accept-Language", "pt-BR,pt;q=0.9,en;q=0.8");
        }
        return builder.GET().build();
    }

    static String redact(String url) {
        return url == null ? null : SECRET_PARAM.matcher(url).replaceAll("$1***");
    }

    static String refererFor(URI uri) {
        String path = uri.getPath() == null ? "" : uri.getPath();
        String segment = path.substring(path.lastIndexOf('/') + 1);
        if (segment.endsWith(".html")) {
            segment = segment.substring(0, segment.length() - ".html".length());
        }
        return REFERER_PREFIX + URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private boolean sleepBeforeAttempt(FetchProfile profile) {
        long minMs = profile.minDelay().toMillis();
        long maxMs = profile.maxDelay().toMillis();
        if (maxMs <= 0) {
            return true;
        }
        long delayMs = minMs >= maxMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs + 1);
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpClient buildClient(ProxyEndpoint proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        if (proxy != null) {
            builder.proxy(proxy.selector());
            Authenticator authenticator = proxy.authenticator();
            if (authenticator != null) {
                builder.authenticator(authenticator);
            }
            log.info("Created HTTP client for proxy {}", proxy.label());
        }
        return builder.build();
    }

    private PageFetchOutcome errorOutcome(
        String url,
        Instant startedAt,
        String proxyLabel,
        FetchStatus status,
        String reason
    ) {
        return new PageFetchOutcome(url, 0, null, status, proxyLabel, Duration.between(startedAt, Instant.now()), reason);
    }

    private static String pick(List<String> pool, String fallback) {
        if (pool == null || pool.isEmpty()) {
            return fallback;
        }
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }

    /**
     * Uses the Content-Type charset when declared. Otherwise JSON is read as UTF-8, and pages are
     * read with the charset Jsoup finds in a BOM or {@code <meta>} tag, falling back to ISO-8859-1
     * when the bytes are not valid UTF-8.
     */
    static String decodeBody(byte[] bytes, String contentType) {
        if (bytes == null) {
            return null;
        }
        Charset declared = declaredCharset(contentType);
        if (declared != null) {
            return new String(bytes, declared);
        }
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json")) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        Charset detected = detectedCharset(bytes);
        if (!StandardCharsets.UTF_8.equals(detected)) {
            return new String(bytes, detected);
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            log.debug("Body is not valid UTF-8 and declares no charset, reading as ISO-8859-1");
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static Charset declaredCharset(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.debug("Unknown charset {} in Content-Type, detecting from body", name);
                    return null;
                }
            }
        }
        return null;
    }

    private static Charset detectedCharset(byte[] bytes) {
        try {
            Document document = Jsoup.parse(new ByteArrayInputStream(bytes), null, "");
            return document.charset();
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Charset detection failed: {}", e.toString());
            return StandardCharsets.UTF_8;
        }
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            return uri.getHost() == null ? null : uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
