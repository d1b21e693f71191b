package com.delta.cnpjresolver.resolve.api;

public record ResolveRequest(String companyName, Boolean includeBranches) {
}
