package com.delta.cnpjresolver.resolve.service;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.model.BatchRunSummary;
import com.delta.cnpjresolver.resolve.model.CompanyOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class ResolveCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResolveCliRunner.class);

    private final ResolverProperties properties;
    private final CsvCompanySource companySource;
    private final CompanyResolutionService resolutionService;
    private final ConfigurableApplicationContext applicationContext;

    public ResolveCliRunner(
        ResolverProperties properties,
        CsvCompanySource companySource,
        CompanyResolutionService resolutionService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.companySource = companySource;
        this.resolutionService = resolutionService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitStatus;
        try {
            BatchRunSummary summary = runMode(properties.getCli().getMode());
            for (CompanyOutcome company : summary.companies()) {
                log.info(
                    "Summary {}: status={}, cnpj={}, branches={}, written={}, error={}",
                    company.companyName(),
                    company.status(),
                    company.cnpj(),
                    company.branchesFound(),
                    company.branchRowsWritten(),
                    company.error()
                );
            }
            exitStatus = summary.hasFatalFailures() ? 1 : 0;
        } catch (ResolutionException e) {
            log.error("Batch aborted: {}", e.getMessage(), e);
            exitStatus = 2;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitStatus;
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }

    private BatchRunSummary runMode(String mode) {
        if (ResolverProperties.Cli.MODE_BRANCHES_ONLY.equals(mode)) {
            log.info("Running branch backfill against {}", properties.getBatch().getOutputCsv());
            return resolutionService.runBranchBackfill();
        }
        if (!ResolverProperties.Cli.MODE_RESOLVE.equals(mode)) {
            throw new ResolutionException("Unknown cli mode '" + mode + "', expected "
                + ResolverProperties.Cli.MODE_RESOLVE + " or " + ResolverProperties.Cli.MODE_BRANCHES_ONLY);
        }
        List<String> companies = companySource.read(Path.of(properties.getBatch().getInputCsv()));
        return resolutionService.runBatch(companies);
    }
}
