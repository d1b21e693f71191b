package com.delta.cnpjresolver.resolve.model;

public record CompanyOutcome(
    String companyName,
    ResolutionStatus status,
    Cnpj cnpj,
    int branchesFound,
    int branchRowsWritten,
    boolean fatal,
    String error
) {
    public static CompanyOutcome fatal(String companyName, String error) {
        return new CompanyOutcome(companyName, ResolutionStatus.ERROR, null, 0, 0, true, error);
    }
}
