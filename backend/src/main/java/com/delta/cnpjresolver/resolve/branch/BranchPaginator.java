package com.delta.cnpjresolver.resolve.branch;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.http.AntiBlockingHttpClient;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.http.FetchProfile;
import com.delta.cnpjresolver.resolve.model.BranchCrawlResult;
import com.delta.cnpjresolver.resolve.model.BranchEntry;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.FetchResult;
import com.delta.cnpjresolver.resolve.service.InvalidCompanyNameException;
import com.delta.cnpjresolver.resolve.util.SlugNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Walks every listing page of a company's branch directory, breadth first, and collects the
 * branch CNPJs other than the primary one.
 */
@Service
public class BranchPaginator {
    private static final Logger log = LoggerFactory.getLogger(BranchPaginator.class);

    private final AntiBlockingHttpClient httpClient;
    private final BranchListingParser parser;
    private final ResolverProperties properties;

    public BranchPaginator(AntiBlockingHttpClient httpClient, BranchListingParser parser, ResolverProperties properties) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.properties = properties;
    }

    public String seedUrl(String companyName, Cnpj primary) {
        String slug = SlugNormalizer.normalize(companyName);
        if (slug.isEmpty()) {
            throw new InvalidCompanyNameException("Company name has no usable characters: " + companyName);
        }
        String base = properties.getBranches().getDirectoryBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/filiais/" + slug + "-" + primary.digits() + ".html";
    }

    public BranchCrawlResult crawl(String companyName, Cnpj primary, CancellationToken token) {
        String seed = seedUrl(companyName, primary);
        FetchProfile profile = FetchProfile.directoryPage(properties);
        int maxPages = properties.getBranches().getMaxPages();
        boolean canonicalize = properties.getBranches().isCanonicalizePageUrls();

        ArrayDeque<String> queue = new ArrayDeque<>();
        Set<String> queued = new LinkedHashSet<>();
        Set<String> visited = new LinkedHashSet<>();
        Map<String, BranchEntry> entries = new LinkedHashMap<>();
        int pagesFailed = 0;
        boolean cancelled = false;

        String normalizedSeed = canonicalize ? canonicalize(seed) : seed;
        queue.addLast(normalizedSeed);
        queued.add(normalizedSeed);

        while (!queue.isEmpty() && visited.size() < maxPages) {
            if (token != null && token.isCancelled()) {
                cancelled = true;
                break;
            }
            String current = queue.removeFirst();
            if (visited.contains(current)) {
                continue;
            }
            visited.add(current);

            FetchResult fetch = httpClient.fetch(current, profile, token);
            if (!fetch.isSuccessful()) {
                if (fetch.cancelled()) {
                    cancelled = true;
                    break;
                }
                pagesFailed++;
                log.warn("Branch page {} unavailable after {} attempts ({}), skipping", current, fetch.attemptCount(), fetch.lastReason());
                continue;
            }

            BranchListingParser.BranchPage page = parser.parse(fetch.body(), current);
            for (BranchEntry entry : page.entries()) {
                entries.put(entry.cnpj().digits(), entry);
            }
            for (String link : page.pageLinks()) {
                String next = canonicalize ? canonicalize(link) : link;
                if (!visited.contains(next) && queued.add(next)) {
                    queue.addLast(next);
                }
            }
            log.debug("Branch page {} gave {} rows, {} pages queued", current, page.entries().size(), queue.size());
        }

        if (!queue.isEmpty() && visited.size() >= maxPages) {
            log.warn("Branch crawl for {} stopped at max pages {} with {} pages left", companyName, maxPages, queue.size());
        }
        entries.remove(primary.digits());
        log.info(
            "Branch crawl for {} finished: branches={} pagesVisited={} pagesFailed={} cancelled={}",
            companyName,
            entries.size(),
            visited.size(),
            pagesFailed,
            cancelled
        );
        return new BranchCrawlResult(seed, new ArrayList<>(entries.values()), visited.size(), pagesFailed, cancelled);
    }

    /**
     * Drops the fragment and every query parameter except {@code p}.
     */
    static String canonicalize(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return url;
            }
            String page = null;
            String query = uri.getRawQuery();
            if (query != null) {
                for (String pair : query.split("&")) {
                    if (pair.startsWith("p=")) {
                        page = pair.substring(2);
                    }
                }
            }
            String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
            StringBuilder canonical = new StringBuilder();
            canonical.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append(path);
            if (page != null && !page.isEmpty()) {
                canonical.append("?p=").append(page);
            }
            return canonical.toString();
        } catch (URISyntaxException e) {
            return url;
        }
    }
}
