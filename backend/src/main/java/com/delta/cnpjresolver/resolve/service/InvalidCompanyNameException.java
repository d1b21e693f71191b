package com.delta.cnpjresolver.resolve.service;

public class InvalidCompanyNameException extends IllegalArgumentException {
    public InvalidCompanyNameException(String message) {
        super(message);
    }
}
