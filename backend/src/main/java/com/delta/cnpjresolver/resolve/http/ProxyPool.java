package com.delta.cnpjresolver.resolve.http;

import com.delta.cnpjresolver.resolve.service.ResolutionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable proxy list shared by every worker. Each call to {@link #next()} advances one global cursor.
 */
public class ProxyPool {
    private final List<ProxyEndpoint> endpoints;
    private final AtomicLong cursor = new AtomicLong();

    public ProxyPool(List<ProxyEndpoint> endpoints) {
        this.endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
    }

    public static ProxyPool empty() {
        return new ProxyPool(List.of());
    }

    public static ProxyPool fromStrings(List<String> values) {
        List<ProxyEndpoint> parsed = new ArrayList<>();
        if (values != null) {
            for (int i = 0; i < values.size(); i++) {
                String value = values.get(i);
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    parsed.add(ProxyEndpoint.parse(value));
                } catch (IllegalArgumentException e) {
                    throw new ResolutionException("Invalid proxy configuration at position " + i + ": " + e.getMessage(), e);
                }
            }
        }
        return new ProxyPool(parsed);
    }

    public Optional<ProxyEndpoint> next() {
        if (endpoints.isEmpty()) {
            return Optional.empty();
        }
        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) endpoints.size());
        return Optional.of(endpoints.get(index));
    }

    public int size() {
        return endpoints.size();
    }

    public boolean isEmpty() {
        return endpoints.isEmpty();
    }

    public long position() {
        return cursor.get();
    }
}
