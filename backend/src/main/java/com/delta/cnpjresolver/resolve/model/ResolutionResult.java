package com.delta.cnpjresolver.resolve.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of resolving one company. {@code selected} is {@code null} unless a candidate was found.
 */
public record ResolutionResult(
    String companyName,
    Cnpj selected,
    List<Cnpj> candidates,
    String sourceUrl,
    ResolutionStatus status,
    List<String> trail,
    boolean headOfficeConfirmed
) {
    public ResolutionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        trail = trail == null ? List.of() : List.copyOf(trail);
    }

    public static ResolutionResult error(String companyName, List<String> trail) {
        return new ResolutionResult(companyName, null, List.of(), null, ResolutionStatus.ERROR, trail, false);
    }

    public boolean hasSelection() {
        return selected != null;
    }

    @JsonProperty("notes")
    public String notes() {
        return String.join("; ", trail);
    }
}
