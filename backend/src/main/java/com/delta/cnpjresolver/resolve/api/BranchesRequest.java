package com.delta.cnpjresolver.resolve.api;

public record BranchesRequest(String companyName, String cnpj) {
}
