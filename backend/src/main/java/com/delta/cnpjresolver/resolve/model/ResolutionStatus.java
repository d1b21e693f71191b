package com.delta.cnpjresolver.resolve.model;

public enum ResolutionStatus {
    SUCCESS,
    MULTIPLE,
    NOT_FOUND,
    ERROR
}
