package com.delta.cnpjresolver.resolve.model;

import java.time.Instant;
import java.util.List;

public record BatchRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int companiesRequested,
    int companiesSkipped,
    int succeeded,
    int multiple,
    int notFound,
    int errors,
    int fatal,
    int branchRowsWritten,
    List<CompanyOutcome> companies
) {
    public BatchRunSummary {
        companies = companies == null ? List.of() : List.copyOf(companies);
    }

    public boolean hasFatalFailures() {
        return fatal > 0;
    }
}
