package com.delta.cnpjresolver.resolve.model;

public record RegistryRecord(Cnpj cnpj, boolean headOffice, String legalName, String sourceUrl) {
}
