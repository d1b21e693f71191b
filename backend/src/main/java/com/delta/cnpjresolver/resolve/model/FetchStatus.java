package com.delta.cnpjresolver.resolve.model;

public enum FetchStatus {
    OK,
    BLOCKED,
    TRANSIENT_ERROR,
    FATAL_ERROR
}
