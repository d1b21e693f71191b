package com.delta.cnpjresolver.resolve.service;

/**
 * Fatal fault that aborts the current company: bad configuration or an unexpected failure.
 */
public class ResolutionException extends RuntimeException {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
