package com.delta.cnpjresolver.resolve.api;

import com.delta.cnpjresolver.resolve.model.BranchCrawlResult;
import com.delta.cnpjresolver.resolve.model.ResolutionResult;

public record ResolveResponse(ResolutionResult resolution, BranchCrawlResult branches) {
}
