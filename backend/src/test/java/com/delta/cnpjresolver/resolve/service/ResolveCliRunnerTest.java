package com.delta.cnpjresolver.resolve.service;

import com.delta.cnpjresolver.config.ResolverProperties;
import com.delta.cnpjresolver.resolve.model.BatchRunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResolveCliRunnerTest {
    @Mock
    private CsvCompanySource companySource;
    @Mock
    private CompanyResolutionService resolutionService;
    @Mock
    private ConfigurableApplicationContext applicationContext;

    private ResolverProperties properties;
    private ResolveCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ResolverProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        runner = new ResolveCliRunner(properties, companySource, resolutionService, applicationContext);
    }

    @Test
    void resolveModeReadsInputAndRunsBatch() {
        properties.getBatch().setInputCsv("companies.csv");
        when(companySource.read(Path.of("companies.csv"))).thenReturn(List.of("Embraer"));
        when(resolutionService.runBatch(List.of("Embraer"))).thenReturn(emptySummary());

        runner.run(new DefaultApplicationArguments());

        verify(resolutionService).runBatch(List.of("Embraer"));
        verify(resolutionService, never()).runBranchBackfill();
    }

    @Test
    void branchesOnlyModeBackfillsWithoutReadingInput() {
        properties.getCli().setMode(" Branches-Only ");
        when(resolutionService.runBranchBackfill()).thenReturn(emptySummary());

        runner.run(new DefaultApplicationArguments());

        verify(resolutionService).runBranchBackfill();
        verify(resolutionService, never()).runBatch(any());
        verifyNoInteractions(companySource);
    }

    @Test
    void unknownModeAbortsWithoutRunning() {
        properties.getCli().setMode("everything");

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();

        verifyNoInteractions(companySource, resolutionService);
    }

    @Test
    void disabledRunnerDoesNothing() {
        properties.getCli().setRun(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(companySource, resolutionService, applicationContext);
    }

    private static BatchRunSummary emptySummary() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return new BatchRunSummary(now, now, 0, 0, 0, 0, 0, 0, 0, 0, List.of());
    }
}
