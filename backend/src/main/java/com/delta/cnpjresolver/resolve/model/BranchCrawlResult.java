package com.delta.cnpjresolver.resolve.model;

import java.util.List;

public record BranchCrawlResult(
    String seedUrl,
    List<BranchEntry> branches,
    int pagesVisited,
    int pagesFailed,
    boolean cancelled
) {
    public BranchCrawlResult {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }
}
