package com.delta.cnpjresolver.resolve.service;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.branch.BranchPaginator;
import com.delta.cnpjresolver.resolve.http.CancellationToken;
import com.delta.cnpjresolver.resolve.model.BatchRunSummary;
import com.delta.cnpjresolver.resolve.model.BranchCrawlResult;
import com.delta.cnpjresolver.resolve.model.Cnpj;
import com.delta.cnpjresolver.resolve.model.CompanyOutcome;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;
import com.delta.cnpjresolver.resolve.model.ResolutionStatus;
import com.delta.cnpjresolver.resolve.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CompanyResolutionService {
    private static final Logger log = LoggerFactory.getLogger(CompanyResolutionService.class);

    private final LayeredResolver resolver;
    private final BranchPaginator branchPaginator;
    private final ResultSink sink;
    private final ResolverProperties properties;
    private final ExecutorService resolverExecutor;
    private final Clock clock;

    public CompanyResolutionService(
        LayeredResolver resolver,
        BranchPaginator branchPaginator,
        ResultSink sink,
        ResolverProperties properties,
        @Qualifier("resolverExecutor") ExecutorService resolverExecutor,
        Clock clock
    ) {
        this.resolver = resolver;
        this.branchPaginator = branchPaginator;
        this.sink = sink;
        this.properties = properties;
        this.resolverExecutor = resolverExecutor;
        this.clock = clock;
    }

    /**
     * Resolves without writing anything. Throws {@link InvalidCompanyNameException} for unusable names.
     */
    public ResolutionResult resolveOnly(String companyName) {
        String name = LayeredResolver.requireUsableName(companyName);
        return resolver.resolve(name, newToken());
    }

    public BranchCrawlResult crawlBranches(String companyName, Cnpj primary) {
        String name = LayeredResolver.requireUsableName(companyName);
        return branchPaginator.crawl(name, primary, newToken());
    }

    public CompanyOutcome process(String companyName) {
        CancellationToken token = newToken();
        try {
            ResolutionResult result = resolver.resolve(companyName, token);
            int branchesFound = 0;
            int branchRowsWritten = 0;
            boolean crawl = result.hasSelection() && properties.getBranches().isEnabled();
            if (crawl && token.isCancelled()) {
                log.warn("Skipping branch crawl for {}: {}", companyName, token.reason());
                crawl = false;
            }
            if (crawl) {
                BranchCrawlResult branches = branchPaginator.crawl(companyName, result.selected(), token);
                branchesFound = branches.branches().size();
                branchRowsWritten = sink.appendCompany(companyName, result, branches.branches());
            } else {
                sink.appendPrimary(companyName, result);
            }
            log.info(
                "Company {}: status={} cnpj={} branches={} written={}",
                companyName,
                result.status(),
                result.selected(),
                branchesFound,
                branchRowsWritten
            );
            return new CompanyOutcome(
                companyName,
                result.status(),
                result.selected(),
                branchesFound,
                branchRowsWritten,
                false,
                null
            );
        } catch (ResolutionException e) {
            log.error("Fatal error resolving {}: {}", companyName, e.getMessage(), e);
            return CompanyOutcome.fatal(companyName, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error resolving {}", companyName, e);
            return CompanyOutcome.fatal(companyName, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Crawls branches for one company whose primary CNPJ is already recorded.
     * The outcome carries no resolution status.
     */
    public CompanyOutcome backfillBranches(String companyName, Cnpj primary) {
        try {
            BranchCrawlResult crawl = branchPaginator.crawl(companyName, primary, newToken());
            int written = sink.appendBranches(companyName, primary, crawl.branches());
            log.info("Backfilled {} branch rows for {} ({} found)", written, companyName, crawl.branches().size());
            return new CompanyOutcome(companyName, null, primary, crawl.branches().size(), written, false, null);
        } catch (ResolutionException e) {
            log.error("Fatal error crawling branches for {}: {}", companyName, e.getMessage(), e);
            return CompanyOutcome.fatal(companyName, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error crawling branches for {}", companyName, e);
            return CompanyOutcome.fatal(companyName, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public BatchRunSummary runBatch(List<String> companyNames) {
        Instant startedAt = Instant.now(clock);
        List<String> requested = companyNames == null ? List.of() : companyNames;
        Set<String> done = properties.getBatch().isResume()
            ? sink.processedCompanies().stream().map(name -> name.toLowerCase(Locale.ROOT)).collect(Collectors.toSet())
            : Set.of();

        Map<String, String> pending = new LinkedHashMap<>();
        int skipped = 0;
        for (String raw : requested) {
            String name = raw == null ? "" : raw.trim();
            String key = name.toLowerCase(Locale.ROOT);
            if (name.isEmpty() || pending.containsKey(key) || done.contains(key)) {
                skipped++;
                continue;
            }
            pending.put(key, name);
        }
        log.info("Batch starting: {} companies requested, {} to process, {} skipped", requested.size(), pending.size(), skipped);

        List<CompanyOutcome> outcomes = runAll(new ArrayList<>(pending.values()), this::process);
        return finish(summarize(startedAt, requested.size(), skipped, outcomes));
    }

    /**
     * Crawls branches for every recorded primary CNPJ that has no branch rows yet.
     */
    public BatchRunSummary runBranchBackfill() {
        Instant startedAt = Instant.now(clock);
        Map<String, Cnpj> targets = sink.primariesWithoutBranches();
        log.info("Branch backfill starting: {} companies without branch rows", targets.size());
        List<CompanyOutcome> outcomes = runAll(
            new ArrayList<>(targets.keySet()),
            name -> backfillBranches(name, targets.get(name))
        );
        return finish(summarize(startedAt, targets.size(), 0, outcomes));
    }

    private List<CompanyOutcome> runAll(List<String> names, Function<String, CompanyOutcome> task) {
        List<Future<CompanyOutcome>> futures = new ArrayList<>();
        for (String name : names) {
            futures.add(resolverExecutor.submit(() -> task.apply(name)));
        }
        List<CompanyOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Worker failed for {}", names.get(i), cause);
                outcomes.add(CompanyOutcome.fatal(names.get(i), cause.toString()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch interrupted after {} of {} companies", outcomes.size(), futures.size());
                futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                break;
            }
        }
        return outcomes;
    }

    private BatchRunSummary finish(BatchRunSummary summary) {
        log.info(
            "Batch finished in {}s: success={} multiple={} notFound={} errors={} fatal={} branchRows={}",
            Duration.between(summary.startedAt(), summary.finishedAt()).toSeconds(),
            summary.succeeded(),
            summary.multiple(),
            summary.notFound(),
            summary.errors(),
            summary.fatal(),
            summary.branchRowsWritten()
        );
        return summary;
    }

    private BatchRunSummary summarize(Instant startedAt, int requested, int skipped, List<CompanyOutcome> outcomes) {
        int succeeded = 0;
        int multiple = 0;
        int notFound = 0;
        int errors = 0;
        int fatal = 0;
        int branchRows = 0;
        for (CompanyOutcome outcome : outcomes) {
            branchRows += outcome.branchRowsWritten();
            if (outcome.fatal()) {
                fatal++;
                continue;
            }
            if (outcome.status() == null) {
                continue;
            }
            if (outcome.status() == ResolutionStatus.SUCCESS) {
                succeeded++;
            } else if (outcome.status() == ResolutionStatus.MULTIPLE) {
                multiple++;
            } else if (outcome.status() == ResolutionStatus.NOT_FOUND) {
                notFound++;
            } else {
                errors++;
            }
        }
        return new BatchRunSummary(
            startedAt,
            Instant.now(clock),
            requested,
            skipped,
            succeeded,
            multiple,
            notFound,
            errors,
            fatal,
            branchRows,
            outcomes
        );
    }

    private CancellationToken newToken() {
        int budgetSeconds = properties.getBatch().getCompanyBudgetSeconds();
        return CancellationToken.withBudget(clock, Duration.ofSeconds(budgetSeconds));
    }
}
