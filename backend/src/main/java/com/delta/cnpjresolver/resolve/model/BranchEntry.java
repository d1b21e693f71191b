package com.delta.cnpjresolver.resolve.model;

public record BranchEntry(String label, Cnpj cnpj) {
}
