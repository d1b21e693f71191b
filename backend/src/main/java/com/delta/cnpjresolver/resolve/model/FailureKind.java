package com.delta.cnpjresolver.resolve.model;

public enum FailureKind {
    INVALID_INPUT,
    SOURCE_UNAVAILABLE,
    PARSE_MISS,
    CHECKSUM_INVALID,
    AMBIGUOUS_RESULT,
    FATAL
}
