package com.delta.cnpjresolver.resolve.api;

public record CnpjCheckResponse(String input, String digits, boolean valid, String formatted) {
}
