package com.delta.cnpjresolver.resolve.model;

import com.delta.cnpjresolver.resolve.util.CnpjValidator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A checksum-valid CNPJ held as its 14 raw digits.
 */
public record Cnpj(String digits) {
    public Cnpj {
        if (!CnpjValidator.isValid(digits)) {
            throw new IllegalArgumentException("Not a valid CNPJ: " + digits);
        }
    }

    public static Optional<Cnpj> parse(String value) {
        String digits = CnpjValidator.extractDigits(value);
        if (!CnpjValidator.isValid(digits)) {
            return Optional.empty();
        }
        return Optional.of(new Cnpj(digits));
    }

    public static List<Cnpj> findAll(String text) {
        List<Cnpj> found = new ArrayList<>();
        for (String candidate : CnpjValidator.extractValid(text)) {
            parse(candidate).ifPresent(found::add);
        }
        return found;
    }

    @JsonValue
    public String formatted() {
        return CnpjValidator.format(digits);
    }

    @Override
    public String toString() {
        return formatted();
    }
}
